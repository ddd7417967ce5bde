package com.abba.ainay.application.notification;

public record RecordOutcome(int recorded, String error) {

    public static RecordOutcome written(int recorded) {
        return new RecordOutcome(recorded, null);
    }

    public static RecordOutcome failed(String error) {
        return new RecordOutcome(0, error);
    }

    /**
     * The store rejected the batch after acknowledging {@code recorded} rows of it.
     */
    public static RecordOutcome partial(int recorded, String error) {
        return new RecordOutcome(recorded, error);
    }

    public boolean success() {
        return error == null;
    }
}
