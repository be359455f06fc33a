package ru.datana.integration.dataparc;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.ZoneId;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import ru.datana.integration.dataparc.config.ConnectorSettings;
import ru.datana.integration.dataparc.service.DataParcConnector;

@SpringBootTest
class DataParcConnectorApplicationTests {
	@Autowired
	private DataParcConnector connector;

	@Test
	void settingsAreResolvedAtStartup() {
		ConnectorSettings settings = connector.getSettings();

		assertThat(settings.getServer()).isEqualTo("localhost");
		assertThat(settings.getUser()).isEqualTo("test_user");
		assertThat(settings.getSiteAbbreviation()).isEqualTo("TEST");
		assertThat(settings.getDatabase()).isEqualTo("ctc_config");
		assertThat(settings.getTimezone()).isEqualTo(ZoneId.of("Asia/Seoul"));
	}
}
