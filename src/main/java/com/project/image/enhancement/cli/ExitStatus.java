package com.project.image.enhancement.cli;

/** Process exit codes, one per fatal cause. */
public enum ExitStatus {
    SUCCESS(0),
    USAGE(1),
    INPUT_UNREADABLE(2),
    DETECTOR_UNAVAILABLE(3),
    OUTPUT_UNWRITABLE(4);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
