package uk.gegc.creditledger.features.overage.application;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import uk.gegc.creditledger.features.overage.domain.event.OverageRecordedEvent;
import uk.gegc.creditledger.shared.email.EmailService;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OverageNotifierTest {

    @Mock
    private EmailService emailService;

    @InjectMocks
    private OverageNotifier notifier;

    private OverageRecordedEvent event() {
        return new OverageRecordedEvent(this, UUID.randomUUID(), "Acme", "owner@acme.test",
                1500L, 1000L, new BigDecimal("5.00"), "usd");
    }

    @Test
    void emailsTheOwner() {
        notifier.onOverageRecorded(event());

        verify(emailService).sendOverageNotification("owner@acme.test", "Acme", 1500L, 1000L,
                new BigDecimal("5.00"), "usd");
    }

    @Test
    void mailFailureDoesNotPropagate() {
        doThrow(new MailSendException("smtp down")).when(emailService)
                .sendOverageNotification(anyString(), anyString(), anyLong(), anyLong(), any(), anyString());

        assertThatCode(() -> notifier.onOverageRecorded(event())).doesNotThrowAnyException();
    }
}
