/**
 * Transfer Header Codec: Implementation
 * =============================================================================
 *
 * <p>Concrete header codec plus the exact-read primitive it is built on.</p>
 *
 * <pre>
 *   InputStream
 *        → ExactReads.readExactly(2)   name length
 *        → ExactReads.readExactly(N)   name
 *        → ExactReads.readExactly(8)   payload size
 *        → TransferHeader
 * </pre>
 *
 * <p>{@link com.questrail.filetransfer.codec.impl.ExactReads} is also used by
 * the receiver to drain the payload chunk by chunk, so header and payload share
 * a single underrun rule: end-of-stream before the declared count is an
 * {@code INCOMPLETE_STREAM} failure.</p>
 */
package com.questrail.filetransfer.codec.impl;
