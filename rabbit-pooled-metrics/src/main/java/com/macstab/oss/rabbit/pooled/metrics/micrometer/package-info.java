/* (C)2026 Macstab GmbH */

/**
 * Micrometer metrics for pooled RabbitMQ connections and channels.
 *
 * <h2>Quick Start</h2>
 *
 * <p><strong>1. Add dependency (Maven):</strong>
 *
 * <pre>{@code
 * <dependency>
 *   <groupId>com.macstab.oss.rabbit</groupId>
 *   <artifactId>rabbit-pooled-metrics</artifactId>
 *   <version>1.0.0</version>
 * </dependency>
 * }</pre>
 *
 * <p><strong>2. Metrics auto-activate when a {@code MeterRegistry} bean exists:</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     pooled-rabbit:
 *       enabled: true           # default
 *       connection-name: orders # same as spring.rabbitmq.pooled.connection-name
 * }</pre>
 *
 * <h2>Metrics Published</h2>
 *
 * <table>
 *   <caption>Meters</caption>
 *   <tr><th>Name</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>rabbitmq.pooled.resources.created</td><td>Counter</td>
 *       <td>connection.name, pool.name</td></tr>
 *   <tr><td>rabbitmq.pooled.resources.creation.failures</td><td>Counter</td>
 *       <td>connection.name, pool.name</td></tr>
 *   <tr><td>rabbitmq.pooled.acquire.wait</td><td>Timer</td>
 *       <td>connection.name, pool.name</td></tr>
 *   <tr><td>rabbitmq.pooled.pool.live</td><td>Gauge</td><td>connection.name, pool.name</td></tr>
 *   <tr><td>rabbitmq.pooled.pool.idle</td><td>Gauge</td><td>connection.name, pool.name</td></tr>
 *   <tr><td>rabbitmq.pooled.queue.channels</td><td>Gauge</td><td>connection.name</td></tr>
 * </table>
 *
 * <p>{@code pool.name} is {@code connections} or {@code channels}.
 *
 * <h2>Custom Implementation</h2>
 *
 * <p>Declare a {@link com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics} bean; the
 * auto-configuration backs off.
 */
package com.macstab.oss.rabbit.pooled.metrics.micrometer;
