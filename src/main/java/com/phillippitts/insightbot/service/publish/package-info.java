/**
 * Publishing of reports and notices to guild text channels.
 *
 * <p>{@link com.phillippitts.insightbot.service.publish.ReportPublisher} renders; the
 * {@link com.phillippitts.insightbot.service.publish.PublishTarget} capability delivers. The
 * bundled {@link com.phillippitts.insightbot.service.publish.InMemoryReportBoard} keeps posted
 * messages in memory for the report endpoint.
 *
 * @since 1.0
 */
package com.phillippitts.insightbot.service.publish;
