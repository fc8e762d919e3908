package com.example.routing.telemetry;

import java.util.Arrays;

/**
 * Fixed-size ring of the most recent latency samples.
 */
public class LatencyWindow {

    private final double[] samples;
    private int next;
    private int count;

    public LatencyWindow(int capacity) {
        this.samples = new double[Math.max(1, capacity)];
    }

    public synchronized void record(double millis) {
        samples[next] = millis;
        next = (next + 1) % samples.length;
        if (count < samples.length) {
            count++;
        }
    }

    public synchronized Summary summary() {
        if (count == 0) {
            return new Summary(0, 0.0, 0.0, 0.0);
        }
        double[] sorted = Arrays.copyOf(samples, count);
        Arrays.sort(sorted);
        double sum = 0.0;
        for (double sample : sorted) {
            sum += sample;
        }
        int p95Index = Math.min((int) (count * 0.95), count - 1);
        return new Summary(count, sum / count, sorted[p95Index], sorted[count - 1]);
    }

    public synchronized void clear() {
        Arrays.fill(samples, 0.0);
        next = 0;
        count = 0;
    }

    public record Summary(int samples, double avgMs, double p95Ms, double maxMs) {}
}
