/**
 * JDBC mesh store pooled with HikariCP; the schema is created on startup.
 */
package ca.gc.cra.meshradar.infrastructure.persistence.jdbc;
