package backend.register;

import java.util.Arrays;

public class LiveRanges {
    private final int[] start;
    private final int[] end;

    public LiveRanges(int count) {
        this.start = new int[count];
        this.end = new int[count];
        Arrays.fill(start, Integer.MAX_VALUE);
        Arrays.fill(end, -1);
    }

    public int count() {
        return start.length;
    }

    public int getStart(int nr) {
        return start[nr];
    }

    public int getEnd(int nr) {
        return end[nr];
    }

    public int length(int nr) {
        return end[nr] - start[nr];
    }

    public void extend(int nr, int ip) {
        start[nr] = Math.min(start[nr], ip);
        end[nr] = Math.max(end[nr], ip);
    }

    public boolean interferes(int a, int b) {
        return !(end[b] <= start[a] || end[a] <= start[b]);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count(); ++i) {
            sb.append("vgrf").append(i).append(": [").append(start[i]).append(", ").append(end[i]).append(")\n");
        }
        return sb.toString();
    }
}
