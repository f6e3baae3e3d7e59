/**
 * Store decorators shared by the memory and JDBC stores.
 */
package ca.gc.cra.meshradar.infrastructure.persistence;
