/**
 * Read-side aggregators: topology edges and traffic rankings over the mesh query port.
 */
package ca.gc.cra.meshradar.application.query;
