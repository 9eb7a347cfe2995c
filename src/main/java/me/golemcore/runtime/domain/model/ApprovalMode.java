package me.golemcore.runtime.domain.model;

/**
 * Session-level approval mode that sets the default policy decision when no
 * explicit rule matches.
 */
public enum ApprovalMode {

    /**
     * Read-only tools run, everything else asks.
     */
    DEFAULT,

    /**
     * File edits run without asking; other mutating tools still ask.
     */
    AUTO_EDIT,

    /**
     * Fully autonomous: anything that would ask is allowed. Explicit deny rules
     * still apply.
     */
    YOLO,

    /**
     * Planning only: mutating tools are denied.
     */
    PLAN
}
