package com.cookapi.jobclient.model;

import java.util.Locale;

/**
 * State filter accepted by the {@code /list} endpoint. Mixes job states
 * (success, failed) with job statuses (waiting, running, completed).
 */
public enum ListState {
    SUCCESS,
    RUNNING,
    FAILED,
    COMPLETED,
    WAITING;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
