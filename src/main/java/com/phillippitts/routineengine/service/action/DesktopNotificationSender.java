package com.phillippitts.routineengine.service.action;

import com.phillippitts.routineengine.config.properties.NotificationProperties;
import com.phillippitts.routineengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.SystemTray;
import java.awt.TrayIcon;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Shows notifications as desktop tray messages when enabled and supported by the platform.
 * Every notification is also logged (length at INFO, truncated preview at DEBUG).
 */
public class DesktopNotificationSender implements NotificationSender {

    private static final Logger LOG = LogManager.getLogger(DesktopNotificationSender.class);

    interface TrayFacade {
        boolean isSupported();

        void display(String title, String message) throws AWTException;
    }

    static final class AwtTrayFacade implements TrayFacade {
        private TrayIcon icon;

        @Override
        public boolean isSupported() {
            return !GraphicsEnvironment.isHeadless() && SystemTray.isSupported();
        }

        @Override
        public synchronized void display(String title, String message) throws AWTException {
            if (icon == null) {
                TrayIcon created = new TrayIcon(new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB), title);
                created.setImageAutoSize(true);
                SystemTray.getSystemTray().add(created);
                icon = created;
            }
            icon.displayMessage(title, message, TrayIcon.MessageType.INFO);
        }
    }

    private final NotificationProperties props;
    private final TrayFacade tray;

    public DesktopNotificationSender(NotificationProperties props) {
        this(props, new AwtTrayFacade());
    }

    // package-private for tests
    DesktopNotificationSender(NotificationProperties props, TrayFacade tray) {
        this.props = Objects.requireNonNull(props);
        this.tray = tray;
    }

    @Override
    public void send(String title, String message) {
        String caption = title == null || title.isBlank() ? props.getTitle() : title;
        LOG.info("Notification '{}' (chars={})", caption, message == null ? 0 : message.length());
        LOG.debug("Notification preview: '{}'", LogSanitizer.truncate(message, props.getMaxLoggedLength()));
        if (!props.isDesktopEnabled()) {
            return;
        }
        try {
            if (tray.isSupported()) {
                tray.display(caption, message == null ? "" : message);
            } else {
                LOG.debug("System tray not supported, notification logged only");
            }
        } catch (AWTException | RuntimeException e) {
            LOG.warn("Desktop notification failed, logged only: {}", e.toString());
        }
    }
}
