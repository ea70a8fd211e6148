package com.routermon.core.routeros;

import com.routermon.exceptions.ProtocolException;

import io.vertx.core.buffer.Buffer;

import java.nio.charset.StandardCharsets;

import java.util.ArrayList;

import java.util.List;

import java.util.function.Consumer;

/**
 * Encoder and streaming decoder for the RouterOS API word framing.

 * Wire format:
 * - a word is a length prefix followed by that many bytes
 * - a sentence is a sequence of words terminated by a zero-length word

 * Length prefix:
 *   len < 0x80          1 byte   len
 *   len < 0x4000        2 bytes  len | 0x8000
 *   len < 0x200000      3 bytes  len | 0xC00000
 *   len < 0x10000000    4 bytes  len | 0xE0000000
 *   otherwise           5 bytes  0xF0 followed by len as 4 bytes

 * Decoding is incremental: feed() accepts arbitrary TCP chunks and hands each
 * complete sentence to the handler.
 */
public class RouterOsWordCodec
{

    private final Consumer<List<String>> sentenceHandler;

    private Buffer pending = Buffer.buffer();

    private List<String> currentSentence = new ArrayList<>();

    public RouterOsWordCodec(Consumer<List<String>> sentenceHandler)
    {
        this.sentenceHandler = sentenceHandler;
    }

    /**
     * Encodes one sentence including its terminating empty word.
     *
     * @param words sentence words, first word is the command or reply type
     * @return wire bytes
     */
    public static Buffer encodeSentence(List<String> words)
    {
        var buffer = Buffer.buffer();

        for (var word : words)
        {
            var bytes = word.getBytes(StandardCharsets.UTF_8);

            appendLength(buffer, bytes.length);

            buffer.appendBytes(bytes);
        }

        buffer.appendByte((byte) 0);

        return buffer;
    }

    static void appendLength(Buffer buffer, int length)
    {
        if (length < 0x80)
        {
            buffer.appendByte((byte) length);
        }
        else if (length < 0x4000)
        {
            var value = length | 0x8000;

            buffer.appendByte((byte) (value >> 8));

            buffer.appendByte((byte) value);
        }
        else if (length < 0x200000)
        {
            var value = length | 0xC00000;

            buffer.appendByte((byte) (value >> 16));

            buffer.appendByte((byte) (value >> 8));

            buffer.appendByte((byte) value);
        }
        else if (length < 0x10000000)
        {
            var value = length | 0xE0000000;

            buffer.appendByte((byte) (value >>> 24));

            buffer.appendByte((byte) (value >> 16));

            buffer.appendByte((byte) (value >> 8));

            buffer.appendByte((byte) value);
        }
        else
        {
            buffer.appendByte((byte) 0xF0);

            buffer.appendByte((byte) (length >>> 24));

            buffer.appendByte((byte) (length >> 16));

            buffer.appendByte((byte) (length >> 8));

            buffer.appendByte((byte) length);
        }
    }

    /**
     * Consumes a chunk of bytes from the socket.
     *
     * @param data received bytes
     * @throws ProtocolException on a reserved control byte or an oversized word
     */
    public void feed(Buffer data)
    {
        pending.appendBuffer(data);

        var position = 0;

        var available = pending.length();

        while (position < available)
        {
            var first = pending.getUnsignedByte(position);

            int headerSize;

            long length;

            if ((first & 0x80) == 0)
            {
                headerSize = 1;

                length = first;
            }
            else if ((first & 0xC0) == 0x80)
            {
                headerSize = 2;

                if (position + headerSize > available)
                {
                    break;
                }

                length = ((first & 0x3F) << 8) | pending.getUnsignedByte(position + 1);
            }
            else if ((first & 0xE0) == 0xC0)
            {
                headerSize = 3;

                if (position + headerSize > available)
                {
                    break;
                }

                length = ((first & 0x1F) << 16)
                    | (pending.getUnsignedByte(position + 1) << 8)
                    | pending.getUnsignedByte(position + 2);
            }
            else if ((first & 0xF0) == 0xE0)
            {
                headerSize = 4;

                if (position + headerSize > available)
                {
                    break;
                }

                length = ((long) (first & 0x0F) << 24)
                    | (pending.getUnsignedByte(position + 1) << 16)
                    | (pending.getUnsignedByte(position + 2) << 8)
                    | pending.getUnsignedByte(position + 3);
            }
            else if (first == 0xF0)
            {
                headerSize = 5;

                if (position + headerSize > available)
                {
                    break;
                }

                length = pending.getUnsignedInt(position + 1);
            }
            else
            {
                throw new ProtocolException(null, String.format("Reserved control byte 0x%02X in reply", first));
            }

            if (length > Integer.MAX_VALUE - headerSize)
            {
                throw new ProtocolException(null, "Word length " + length + " exceeds supported size");
            }

            if (position + headerSize + length > available)
            {
                break;
            }

            var start = position + headerSize;

            var end = start + (int) length;

            position = end;

            if (length == 0)
            {
                var sentence = currentSentence;

                currentSentence = new ArrayList<>();

                if (!sentence.isEmpty())
                {
                    sentenceHandler.accept(sentence);
                }
            }
            else
            {
                currentSentence.add(pending.getString(start, end, "UTF-8"));
            }
        }

        pending = position < available ? pending.getBuffer(position, available) : Buffer.buffer();
    }

}
