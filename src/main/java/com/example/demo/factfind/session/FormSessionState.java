package com.example.demo.factfind.session;

/**
 * Lifecycle of a form session.
 *
 * <pre>
 * NO_TEMPLATE_SELECTED -> TEMPLATE_ACTIVE -> SUBMITTING -> RESULT_READY | SUBMIT_FAILED
 * </pre>
 * Editing from RESULT_READY or SUBMIT_FAILED goes back to TEMPLATE_ACTIVE; aborting a
 * submission goes back to TEMPLATE_ACTIVE as well.
 */
public enum FormSessionState {
    NO_TEMPLATE_SELECTED,
    TEMPLATE_ACTIVE,
    SUBMITTING,
    RESULT_READY,
    SUBMIT_FAILED
}
