package com.questrail.filetransfer.codec.impl;

/**
 * HeaderLayout
 * -----------------------------------------------------------------------------
 * Field widths of the transfer header.
 *
 * <p>All multi-byte integers are big-endian and unsigned.</p>
 */
final class HeaderLayout
{
    /** Width of the name-length prefix. */
    static final int NAME_LENGTH_BYTES = 2;

    /** Width of the payload-size field. */
    static final int FILE_SIZE_BYTES = 8;

    /** Largest encoded name the 2-byte prefix can describe. */
    static final int MAX_NAME_BYTES = 0xFFFF;

    private HeaderLayout() {}
}
