package ru.datana.integration.dataparc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;
import ru.datana.integration.dataparc.service.DataParcConnector;
import ru.datana.integration.dataparc.store.ConnectionFactory;
import ru.datana.integration.dataparc.store.QueryExecutor;
import ru.datana.integration.dataparc.store.SqlServerConnectionFactory;

@Configuration
@Slf4j
public class ConnectorConfiguration {

        @Bean
        ConnectorSettings connectorSettings(DataParcProperties properties) {
                var settings = ConnectorSettings.resolve(properties);
                log.info("DataParc connector configured: {}", settings);
                return settings;
        }

        @Bean
        ConnectionFactory connectionFactory(ConnectorSettings settings) {
                return new SqlServerConnectionFactory(settings);
        }

        @Bean
        QueryExecutor queryExecutor(ConnectionFactory connectionFactory) {
                return new QueryExecutor(connectionFactory);
        }

        @Bean
        DataParcConnector dataParcConnector(ConnectorSettings settings, QueryExecutor queryExecutor) {
                return new DataParcConnector(settings, queryExecutor);
        }
}
