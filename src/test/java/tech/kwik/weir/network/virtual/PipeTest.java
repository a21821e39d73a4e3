/*
 * Copyright © 2025, 2026 Peter Doornbosch
 *
 * This file is part of Weir, an embeddable HTTP/1.1 server engine
 *
 * Weir is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Lesser General Public License as published by the
 * Free Software Foundation, either version 3 of the License, or (at your option)
 * any later version.
 *
 * Weir is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for
 * more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tech.kwik.weir.network.virtual;

import org.junit.jupiter.api.Test;
import tech.kwik.weir.network.BrokenPipeException;
import tech.kwik.weir.network.IOMode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipeTest {

    //region read/write
    @Test
    void bytesWrittenShouldBeReadInSameOrder() throws Exception {
        // Given
        Pipe pipe = new Pipe();
        byte[] data = "hello pipe".getBytes(StandardCharsets.US_ASCII);

        // When
        pipe.getWriter().write(data, 0, data.length);
        byte[] received = new byte[20];
        int read = pipe.getReader().read(received, 0, received.length);

        // Then
        assertThat(read).isEqualTo(data.length);
        assertThat(new String(received, 0, read, StandardCharsets.US_ASCII)).isEqualTo("hello pipe");
    }

    @Test
    void dataShouldWrapAroundRingBuffer() throws Exception {
        // Given
        Pipe pipe = new Pipe(8);
        byte[] buffer = new byte[8];
        pipe.getWriter().write(new byte[] { 1, 2, 3, 4, 5, 6 }, 0, 6);
        pipe.getReader().read(buffer, 0, 5);

        // When
        int written = pipe.getWriter().write(new byte[] { 7, 8, 9, 10, 11, 12 }, 0, 6);
        int read = pipe.getReader().read(buffer, 0, 8);

        // Then
        assertThat(written).isEqualTo(6);
        assertThat(read).isEqualTo(7);
        assertThat(Arrays.copyOf(buffer, 7)).isEqualTo(new byte[] { 6, 7, 8, 9, 10, 11, 12 });
    }

    @Test
    void readAfterWriterClosedShouldReturnBufferedBytesThenEndOfStream() throws Exception {
        // Given
        Pipe pipe = new Pipe();
        pipe.getWriter().write(new byte[] { 42 }, 0, 1);

        // When
        pipe.getWriter().close();

        // Then
        byte[] buffer = new byte[4];
        assertThat(pipe.getReader().read(buffer, 0, 4)).isEqualTo(1);
        assertThat(pipe.getReader().read(buffer, 0, 4)).isEqualTo(-1);
    }

    @Test
    void writeAfterReaderClosedShouldFailWithBrokenPipe() {
        // Given
        Pipe pipe = new Pipe();

        // When
        pipe.getReader().close();

        // Then
        assertThatThrownBy(() -> pipe.getWriter().write(new byte[] { 1 }, 0, 1))
                .isInstanceOf(BrokenPipeException.class);
    }

    @Test
    void blockingReadShouldWaitForWriter() throws Exception {
        // Given
        Pipe pipe = new Pipe();
        CompletableFuture<Integer> reading = CompletableFuture.supplyAsync(() -> {
            try {
                return pipe.getReader().read(new byte[10], 0, 10);
            }
            catch (Exception e) {
                throw new RuntimeException(e);
            }
        });

        // When
        Thread.sleep(50);
        assertThat(reading).isNotDone();
        pipe.getWriter().write(new byte[] { 1, 2, 3 }, 0, 3);

        // Then
        assertThat(reading.get(1, TimeUnit.SECONDS)).isEqualTo(3);
    }
    //endregion

    //region non-blocking
    @Test
    void nonBlockingReadOnEmptyPipeShouldReturnZero() throws Exception {
        // Given
        Pipe pipe = new Pipe();
        pipe.getReader().setIOMode(IOMode.NON_BLOCKING);

        // When
        int read = pipe.getReader().read(new byte[10], 0, 10);

        // Then
        assertThat(read).isEqualTo(0);
    }

    @Test
    void nonBlockingWriteOnFullPipeShouldReturnZero() throws Exception {
        // Given
        Pipe pipe = new Pipe(4);
        pipe.getWriter().setIOMode(IOMode.NON_BLOCKING);

        // When
        int first = pipe.getWriter().write(new byte[6], 0, 6);
        int second = pipe.getWriter().write(new byte[6], 0, 6);

        // Then
        assertThat(first).isEqualTo(4);
        assertThat(second).isEqualTo(0);
    }

    @Test
    void awaitReadableShouldCompleteWhenDataIsWritten() throws Exception {
        // Given
        Pipe pipe = new Pipe();
        CompletableFuture<Void> readable = pipe.getReader().awaitReadable();
        assertThat(readable).isNotDone();

        // When
        pipe.getWriter().write(new byte[] { 1 }, 0, 1);

        // Then
        assertThat(readable).isDone();
    }

    @Test
    void awaitReadableShouldCompleteWhenWriterCloses() {
        // Given
        Pipe pipe = new Pipe();
        CompletableFuture<Void> readable = pipe.getReader().awaitReadable();

        // When
        pipe.getWriter().close();

        // Then
        assertThat(readable).isDone();
    }

    @Test
    void awaitWritableShouldCompleteWhenReaderMakesRoom() throws Exception {
        // Given
        Pipe pipe = new Pipe(2);
        pipe.getWriter().write(new byte[2], 0, 2);
        CompletableFuture<Void> writable = pipe.getWriter().awaitWritable();
        assertThat(writable).isNotDone();

        // When
        pipe.getReader().read(new byte[1], 0, 1);

        // Then
        assertThat(writable).isDone();
    }
    //endregion
}
