package io.chainindex.core.storage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * A virtual file split across numbered physical files of a fixed size, e.g.
 * {@code meta/headers00}, {@code meta/headers01}. Reads past the end return fewer bytes.
 */
public final class LogicalFile {
    private final Path prefix;
    private final int digits;
    private final long fileSize;

    public LogicalFile(Path prefix, int digits, long fileSize) {
        this.prefix = prefix;
        this.digits = digits;
        this.fileSize = fileSize;
    }

    /** Reads up to {@code size} bytes at {@code start}; fewer if the file ends first. */
    public byte[] read(long start, int size) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(size, 0));
        int remaining = size;
        long pos = start;
        while (remaining > 0) {
            Path file = partFor(pos);
            long offset = pos % fileSize;
            int want = (int) Math.min(remaining, fileSize - offset);
            byte[] part;
            try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
                ByteBuffer buf = ByteBuffer.allocate(want);
                while (buf.hasRemaining()) {
                    int n = ch.read(buf, offset + buf.position());
                    if (n < 0) break;
                }
                buf.flip();
                part = new byte[buf.remaining()];
                buf.get(part);
            } catch (NoSuchFileException e) {
                break;
            } catch (IOException e) {
                throw new StorageException("read of " + file + " failed", e);
            }
            if (part.length == 0) {
                break;
            }
            out.writeBytes(part);
            pos += part.length;
            remaining -= part.length;
            if (part.length < want) {
                break;
            }
        }
        return out.toByteArray();
    }

    /** Writes {@code data} at {@code start}, creating part files as needed. */
    public void write(long start, byte[] data) {
        int written = 0;
        long pos = start;
        while (written < data.length) {
            Path file = partFor(pos);
            long offset = pos % fileSize;
            int n = (int) Math.min(data.length - written, fileSize - offset);
            try (FileChannel ch = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(data, written, n);
                long at = offset;
                while (buf.hasRemaining()) {
                    at += ch.write(buf, at);
                }
            } catch (IOException e) {
                throw new StorageException("write of " + file + " failed", e);
            }
            written += n;
            pos += n;
        }
    }

    Path partFor(long position) {
        long fileNum = position / fileSize;
        String name = prefix.getFileName() + String.format("%0" + digits + "d", fileNum);
        Path parent = prefix.getParent();
        return parent == null ? Path.of(name) : parent.resolve(name);
    }
}
