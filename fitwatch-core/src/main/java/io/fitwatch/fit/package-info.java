/**
 * Built-in FIT decoder.
 *
 * <p>{@link io.fitwatch.fit.BinaryFitDecoderFactory} validates the file header and CRCs up
 * front, then decodes definition, data and compressed-timestamp messages on demand. Field
 * names and scaling cover the {@code record} message; other messages expose raw values
 * under {@code unknown_<n>} keys.
 */
package io.fitwatch.fit;
