package amanuensis;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the dataset records of one run as a JSON array.
 */
public final class DatasetWriter {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private DatasetWriter() {
    }

    /**
     * @return the file written, {@code expansion_dataset_<timestamp>.json} in {@code dir}
     */
    public static Path write(List<DatasetRecord> records, Path dir) throws IOException {
        Path file = dir.resolve("expansion_dataset_" + LocalDateTime.now().format(STAMP) + ".json");
        AtomicJsonWriter.write(file, records);
        return file;
    }
}
