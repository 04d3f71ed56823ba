package com.licitia.etl.scheduler;

public record TickReport(int due, int succeeded, int failed, int skipped, int recovered) {

    public static TickReport idle(int recovered) {
        return new TickReport(0, 0, 0, 0, recovered);
    }
}
