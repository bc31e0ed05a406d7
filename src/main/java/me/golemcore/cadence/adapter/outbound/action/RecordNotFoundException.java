package me.golemcore.cadence.adapter.outbound.action;

/**
 * A handler referenced a patient, task, trial or staff member that does not
 * exist. Reported as a not-found failure rather than a bad request.
 */
class RecordNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    RecordNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
