package com.phillippitts.routineengine.service.action;

/**
 * Delivers notification-action messages to the user.
 */
public interface NotificationSender {

    /**
     * Delivers the message. Must not throw; delivery problems are logged.
     */
    void send(String title, String message);
}
