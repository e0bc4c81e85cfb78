package amanuensis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes JSON files so that readers only ever see the previous or the new
 * complete content.
 *
 * <p>The value is serialized into a temporary file in the target directory,
 * forced to disk and then moved over the target. When the file system cannot
 * move atomically, a plain replacing move is used instead.</p>
 */
public final class AtomicJsonWriter {
    private static final Logger LOGGER = Logger.getLogger(AtomicJsonWriter.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AtomicJsonWriter() {
    }

    /**
     * Shared mapper for every JSON file the application reads or writes.
     *
     * @return the object mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Pretty-prints {@code value} as JSON and atomically replaces {@code target}.
     *
     * @param target destination file; parent directories are created
     * @param value  any Jackson-serializable value
     * @throws IOException if serialization or any file operation fails; the
     *                     previous content of {@code target} is left untouched
     */
    public static void write(Path target, Object value) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }

        Path temp = Files.createTempFile(dir, absolute.getFileName().toString() + ".", ".tmp");
        boolean published = false;
        try {
            ObjectWriter writer = MAPPER.writerWithDefaultPrettyPrinter();
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
                 OutputStream out = Channels.newOutputStream(channel)) {
                writer.writeValue(new NonClosingOutputStream(out), value);
                out.flush();
                channel.force(true);
            }
            move(temp, absolute);
            published = true;
        } finally {
            if (!published) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOGGER.log(Level.WARNING, "Failed to delete temp file " + temp, e);
                }
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.log(Level.FINE, "Atomic move not supported for " + target + ", replacing instead", e);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // Jackson closes the stream it writes to; the channel must stay open until forced.
    private static final class NonClosingOutputStream extends java.io.FilterOutputStream {
        NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
