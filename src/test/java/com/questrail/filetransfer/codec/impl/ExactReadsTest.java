package com.questrail.filetransfer.codec.impl;

import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;
import com.questrail.filetransfer.transport.FragmentingInputStream;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

final class ExactReadsTest
{
    private static byte[] pattern(int length)
    {
        byte[] data = new byte[length];
        for (int i = 0; i < length; i++) {
            data[i] = (byte) (i * 31 + 7);
        }
        return data;
    }

    @Test
    void fragmentedDeliveryMatchesBulkDelivery()
    {
        byte[] data = pattern(1000);
        byte[] bulk = ExactReads.readExactly(new ByteArrayInputStream(data), data.length);

        for (int fragment : new int[] { 1, 2, 3, 7, 64, 999, 1000 }) {
            FragmentingInputStream source = new FragmentingInputStream(data, fragment);
            byte[] pieced = ExactReads.readExactly(source, data.length);

            assertArrayEquals(bulk, pieced, "fragment size " + fragment);
            assertEquals(0, source.unread());
        }
    }

    @Test
    void oneByteFragmentsTakeOneReadPerByte()
    {
        FragmentingInputStream source = new FragmentingInputStream(pattern(10), 1);

        ExactReads.readExactly(source, 10);

        assertEquals(10, source.readCalls());
    }

    @Test
    void neverReadsPastTheRequestedCount()
    {
        FragmentingInputStream source = new FragmentingInputStream(pattern(20), 64);

        byte[] first = ExactReads.readExactly(source, 8);

        assertEquals(8, first.length);
        assertEquals(12, source.unread());
    }

    @Test
    void zeroLengthReadDoesNotTouchTheSource()
    {
        FragmentingInputStream source = new FragmentingInputStream(new byte[0], 1);

        assertEquals(0, ExactReads.readExactly(source, 0).length);
        assertEquals(0, source.readCalls());
    }

    @Test
    void shortSourceFailsInsteadOfReturningPartialData()
    {
        FragmentingInputStream source = new FragmentingInputStream(pattern(5), 2);

        TransferException e = assertThrows(TransferException.class, () -> ExactReads.readExactly(source, 6));
        assertEquals(TransferErrorKind.INCOMPLETE_STREAM, e.kind());
    }

    @Test
    void sourceFailureIsAnIncompleteStream()
    {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("Connection reset");
            }
        };

        TransferException e = assertThrows(TransferException.class, () -> ExactReads.readExactly(broken, 4));
        assertEquals(TransferErrorKind.INCOMPLETE_STREAM, e.kind());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void inPlaceVariantFillsTheRequestedRange()
    {
        byte[] buffer = new byte[8];

        ExactReads.readExactly(new FragmentingInputStream(new byte[] { 1, 2, 3 }, 1), buffer, 2, 3);

        assertArrayEquals(new byte[] { 0, 0, 1, 2, 3, 0, 0, 0 }, buffer);
    }

    @Test
    void inPlaceVariantRejectsRangeOutsideBuffer()
    {
        assertThrows(IndexOutOfBoundsException.class,
                () -> ExactReads.readExactly(new ByteArrayInputStream(new byte[4]), new byte[4], 2, 4));
    }
}
