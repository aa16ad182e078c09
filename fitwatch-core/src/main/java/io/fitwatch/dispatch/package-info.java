/**
 * Serialized conversion work.
 *
 * <p>{@link io.fitwatch.dispatch.ConversionDispatcher} owns the FIFO queue and its single
 * worker thread; {@link io.fitwatch.dispatch.RetryController} runs one file through the
 * stability wait, the converter and the retry loop.
 *
 * @see io.fitwatch.dispatch.RetryPolicy
 * @see io.fitwatch.dispatch.Task
 */
package io.fitwatch.dispatch;
