package amanuensiscli;

import java.io.PrintStream;

class ConsoleProgressBar {
    private final int width;
    private final PrintStream out;
    private int lastDone = -1;

    ConsoleProgressBar(int width) {
        this(width, System.err);
    }

    ConsoleProgressBar(int width, PrintStream out) {
        this.width = width;
        this.out = out;
    }

    // documents finish on worker threads
    synchronized void update(int done, int total) {
        if (total <= 0 || done == lastDone) {
            return;
        }
        lastDone = done;

        int percent = done * 100 / total;
        int filled = percent * width / 100;
        StringBuilder sb = new StringBuilder();
        sb.append('\r'); // overwrite same line
        sb.append('[');
        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? '=' : ' ');
        }
        sb.append("] ");
        sb.append(String.format("%3d%% (%d/%d)", percent, done, total));

        out.print(sb);

        if (done >= total) {
            out.println();
        }
    }
}
