package com.questrail.peerlink.transport.socket;

import com.questrail.peerlink.api.LinkFramingException;
import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.codec.FrameCodec;
import com.questrail.peerlink.codec.impl.FrameAssembler;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Optional;

/**
 * StreamReader
 * -----------------------------------------------------------------------------
 * Dedicated reader loop for one connected socket.
 *
 * <p>Reads whatever bytes are available, feeds them to a {@link FrameAssembler}
 * and hands every complete {@link Message} to the sink in wire order. The
 * socket's read timeout bounds each blocking read so the loop notices
 * {@link #stop()} without the socket being closed underneath it.</p>
 *
 * <p>The loop ends on the first of:</p>
 * <ul>
 *   <li>{@link #stop()}: exits quietly</li>
 *   <li>end of stream: reported as a clean disconnect ({@code null} cause)</li>
 *   <li>an I/O error or an oversized frame: reported with the cause</li>
 * </ul>
 * There is no resynchronization after a framing error; the format has no sync
 * marker.
 */
final class StreamReader implements Runnable
{
    private static final int READ_CHUNK_BYTES = 64 * 1024;

    /**
     * Receives the reader's output. Called only from the reader thread.
     */
    interface Sink
    {
        void onMessage(Message message);

        void onEnd(Throwable cause);
    }

    private final InputStream in;
    private final FrameAssembler assembler;
    private final Sink sink;

    private volatile boolean running = true;

    StreamReader(InputStream in, FrameCodec codec, Sink sink)
    {
        this.in = Objects.requireNonNull(in, "in");
        this.assembler = new FrameAssembler(Objects.requireNonNull(codec, "codec"));
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    void stop()
    {
        running = false;
    }

    boolean isRunning()
    {
        return running;
    }

    @Override
    public void run()
    {
        final byte[] chunk = new byte[READ_CHUNK_BYTES];

        while (running) {
            final int n;
            try {
                n = in.read(chunk);
            } catch (SocketTimeoutException e) {
                continue;
            } catch (IOException e) {
                end(e);
                return;
            }

            if (n < 0) {
                end(null);
                return;
            }

            assembler.append(chunk, 0, n);
            try {
                drain();
            } catch (LinkFramingException e) {
                end(e);
                return;
            }
        }
    }

    private void drain()
    {
        Optional<Message> next;
        while (running && (next = assembler.next()).isPresent()) {
            sink.onMessage(next.get());
        }
    }

    private void end(Throwable cause)
    {
        if (running) {
            running = false;
            sink.onEnd(cause);
        }
    }

    int buffered()
    {
        return assembler.buffered();
    }
}
