/**
 * Pure unit conversions applied to CSV cells when readability transforms are enabled.
 */
package io.fitwatch.transform;
