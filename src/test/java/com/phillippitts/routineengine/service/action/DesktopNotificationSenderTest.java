package com.phillippitts.routineengine.service.action;

import com.phillippitts.routineengine.config.properties.NotificationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.AWTException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DesktopNotificationSenderTest {

    private NotificationProperties props;
    private DesktopNotificationSender.TrayFacade tray;

    @BeforeEach
    void setUp() {
        props = new NotificationProperties();
        tray = mock(DesktopNotificationSender.TrayFacade.class);
    }

    @Test
    void logsOnlyWhenDesktopDisabled() throws AWTException {
        new DesktopNotificationSender(props, tray).send("Morning", "Good morning");

        verify(tray, never()).isSupported();
        verify(tray, never()).display(anyString(), anyString());
    }

    @Test
    void displaysOnTrayWhenEnabledAndSupported() throws AWTException {
        props.setDesktopEnabled(true);
        when(tray.isSupported()).thenReturn(true);

        new DesktopNotificationSender(props, tray).send("Morning", "Good morning");

        verify(tray).display("Morning", "Good morning");
    }

    @Test
    void fallsBackToConfiguredTitle() throws AWTException {
        props.setDesktopEnabled(true);
        props.setTitle("Routines");
        when(tray.isSupported()).thenReturn(true);

        new DesktopNotificationSender(props, tray).send(" ", null);

        verify(tray).display("Routines", "");
    }

    @Test
    void skipsTrayWhenUnsupported() throws AWTException {
        props.setDesktopEnabled(true);
        when(tray.isSupported()).thenReturn(false);

        new DesktopNotificationSender(props, tray).send("t", "m");

        verify(tray, never()).display(anyString(), anyString());
    }

    @Test
    void trayFailureDoesNotPropagate() throws AWTException {
        props.setDesktopEnabled(true);
        when(tray.isSupported()).thenReturn(true);
        doThrow(new AWTException("no tray")).when(tray).display(anyString(), anyString());

        assertThatCode(() -> new DesktopNotificationSender(props, tray).send("t", "m"))
                .doesNotThrowAnyException();
    }
}
