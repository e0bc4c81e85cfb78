package amanuensis;

import java.util.Collections;
import java.util.List;

/**
 * A key whose machine and user solutions disagree.
 */
public final class ConflictRecord {
    public final String key;
    public final List<String> machineValue;
    public final List<String> userValue;

    public ConflictRecord(String key, List<String> machineValue, List<String> userValue) {
        this.key = key;
        this.machineValue = Collections.unmodifiableList(machineValue);
        this.userValue = Collections.unmodifiableList(userValue);
    }

    @Override
    public String toString() {
        return key + ": machine=" + machineValue + " user=" + userValue;
    }
}
