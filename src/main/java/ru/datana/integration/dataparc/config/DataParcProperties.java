package ru.datana.integration.dataparc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Explicit connector settings. Anything left empty here falls back to the
 * {@code DATAPARC_*} environment variables, see {@link ConnectorSettings}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "dataparc")
public class DataParcProperties {
        private String server;
        private String username;
        private String password;
        private String siteAbbreviation;
        private String timezone;
        private String database;
        private Integer loginTimeout = 15;
        private boolean encrypt = false;
        private boolean trustServerCertificate = true;
}
