/**
 * Service provider interfaces for plugging the delivery queue into external systems.
 *
 * @see courier.spi.MetricsExporter
 */
package courier.spi;
