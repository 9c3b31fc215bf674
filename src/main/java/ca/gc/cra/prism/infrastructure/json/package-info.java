/** JSON rendering of job records and scheduler metrics (Jackson streaming API). */
package ca.gc.cra.prism.infrastructure.json;
