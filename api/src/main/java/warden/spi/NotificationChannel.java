package warden.spi;

/**
 * Delivery channels a {@link NotificationDispatcher} may be asked to use.
 */
public enum NotificationChannel {
    EMAIL,
    SMS,
    /** Hand-off to the on-call escalation process. */
    ESCALATION
}
