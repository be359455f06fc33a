package ru.datana.integration.dataparc.config;

import static org.apache.commons.lang3.StringUtils.firstNonBlank;
import static org.apache.commons.lang3.StringUtils.isAnyBlank;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.function.UnaryOperator;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import ru.datana.integration.dataparc.exception.ConfigurationException;

/**
 * Connection settings resolved once per connector. Resolution order for every
 * field: explicit value, then the named environment variable, then the default.
 */
@Value
@Builder
public class ConnectorSettings {
        public static final String ENV_SERVER = "DATAPARC_SERVER";
        public static final String ENV_USERNAME = "DATAPARC_USERNAME";
        public static final String ENV_PASSWORD = "DATAPARC_PASSWORD";
        public static final String ENV_SITE_ABBREVIATION = "DATAPARC_SITE_ABBREVIATION";
        public static final String ENV_TIMEZONE = "DATAPARC_TIMEZONE";
        public static final String ENV_DATABASE = "DATAPARC_DATABASE";

        public static final String DEFAULT_TIMEZONE = "UTC";
        public static final String DEFAULT_DATABASE = "ctc_config";
        public static final int DEFAULT_LOGIN_TIMEOUT = 15;

        static final String INCOMPLETE = "Database connection information is incomplete. Please check the environment variables.";

        String server;
        String user;
        @ToString.Exclude
        String password;
        String siteAbbreviation;
        String database;
        ZoneId timezone;
        int loginTimeout;
        boolean encrypt;
        boolean trustServerCertificate;

        public static ConnectorSettings resolve(DataParcProperties explicit) {
                return resolve(explicit, System::getenv);
        }

        /**
         * @throws ConfigurationException when server, user or password is missing or the zone is unknown
         */
        public static ConnectorSettings resolve(DataParcProperties explicit, UnaryOperator<String> environment) {
                var server = firstNonBlank(explicit.getServer(), environment.apply(ENV_SERVER));
                var user = firstNonBlank(explicit.getUsername(), environment.apply(ENV_USERNAME));
                var password = firstNonBlank(explicit.getPassword(), environment.apply(ENV_PASSWORD));
                if (isAnyBlank(server, user, password)) {
                        throw new ConfigurationException(INCOMPLETE);
                }
                var zone = firstNonBlank(explicit.getTimezone(), environment.apply(ENV_TIMEZONE), DEFAULT_TIMEZONE);
                var loginTimeout = explicit.getLoginTimeout();
                return ConnectorSettings.builder()
                                .server(server)
                                .user(user)
                                .password(password)
                                .siteAbbreviation(firstNonBlank(explicit.getSiteAbbreviation(),
                                                environment.apply(ENV_SITE_ABBREVIATION)))
                                .database(firstNonBlank(explicit.getDatabase(), environment.apply(ENV_DATABASE),
                                                DEFAULT_DATABASE))
                                .timezone(toZone(zone))
                                .loginTimeout(loginTimeout == null ? DEFAULT_LOGIN_TIMEOUT : loginTimeout)
                                .encrypt(explicit.isEncrypt())
                                .trustServerCertificate(explicit.isTrustServerCertificate())
                                .build();
        }

        private static ZoneId toZone(String id) {
                try {
                        return ZoneId.of(id);
                } catch (DateTimeException e) {
                        throw new ConfigurationException("Unknown timezone '%s'".formatted(id), e);
                }
        }
}
