/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.jdbc;

import java.util.Set;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.syncbase.config.Configuration;
import io.syncbase.config.Field;

/**
 * A {@link Configuration} of the connection settings of a relational database. The keys carry no prefix; connector
 * configurations obtain one with {@code config.subset("database.", true)}.
 */
public interface JdbcConfiguration extends Configuration {

    Field HOSTNAME = Field.create("hostname")
            .withDisplayName("Hostname")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDescription("Resolvable hostname or IP address of the database server.");

    Field PORT = Field.create("port")
            .withDisplayName("Port")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Port of the database server.");

    Field USER = Field.create("user")
            .withDisplayName("User")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Name of the database user to be used when connecting to the database.");

    Field PASSWORD = Field.create("password")
            .withDisplayName("Password")
            .withType(Type.PASSWORD)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Password of the database user to be used when connecting to the database.");

    Field DATABASE = Field.create("dbname")
            .withDisplayName("Database")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDescription("The name of the database from which changes are captured.");

    Field SCHEMA = Field.create("schema")
            .withDisplayName("Schema")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("The schema containing the watched tables.")
            .withDefault("public");

    /**
     * Obtain a {@link JdbcConfiguration} view of the supplied configuration.
     *
     * @param config the configuration; may not be null
     * @return the JDBC configuration; never null
     */
    static JdbcConfiguration adapt(Configuration config) {
        if (config instanceof JdbcConfiguration) {
            return (JdbcConfiguration) config;
        }
        return new JdbcConfiguration() {
            @Override
            public String getString(String key) {
                return config.getString(key);
            }

            @Override
            public Set<String> keys() {
                return config.keys();
            }

            @Override
            public String toString() {
                return config.toString();
            }
        };
    }

    default String getHostname() {
        return getString(HOSTNAME);
    }

    default String getPort() {
        return getString(PORT);
    }

    default String getUser() {
        return getString(USER);
    }

    default String getPassword() {
        return getString(PASSWORD);
    }

    default String getDatabase() {
        return getString(DATABASE);
    }

    default String getSchema() {
        return getString(SCHEMA);
    }
}
