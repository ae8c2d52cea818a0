package kiokundictcli;

import java.io.PrintStream;

class ConsoleProgressBar {
    private final String label;
    private final int width;
    private final PrintStream out;
    private int lastPercent = -1;

    ConsoleProgressBar(String label, int width, PrintStream out) {
        this.label = label;
        this.width = width;
        this.out = out;
    }

    // called from worker threads
    synchronized void update(int current, int total) {
        if (total <= 0) {
            return;
        }

        int percent = (int) ((long) current * 100 / total);
        if (percent <= lastPercent) {
            return;
        }
        lastPercent = percent;

        int filled = percent * width / 100;
        StringBuilder sb = new StringBuilder();
        sb.append('\r').append(label).append(" [");
        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? '=' : ' ');
        }
        sb.append("] ");
        sb.append(String.format("%3d%% (%d/%d)", percent, current, total));

        out.print(sb);

        if (percent == 100) {
            out.println();
        }
    }
}
