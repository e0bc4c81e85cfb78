package teihelper;

/**
 * Text around an abbreviation, each side bounded by the configured window.
 */
public final class Context {

    public static final Context EMPTY = new Context("", "");

    public final String before;
    public final String after;

    public Context(String before, String after) {
        this.before = before == null ? "" : before;
        this.after = after == null ? "" : after;
    }

    public boolean isEmpty() {
        return before.isEmpty() && after.isEmpty();
    }

    @Override
    public String toString() {
        return "..." + before + " [*] " + after + "...";
    }
}
