package com.parcelsms.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.parcelsms.common.time.WallClock;
import com.parcelsms.notification.model.NotificationIntent;
import com.parcelsms.notification.model.NotificationRecord;
import com.parcelsms.notification.model.NotificationStatus;
import com.parcelsms.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationEnqueueServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2025-10-10T10:00:00Z");
  private static final Instant DUE_AT = Instant.parse("2025-10-13T10:00:00Z");
  private static final UUID APPOINTMENT_ID = UUID.randomUUID();
  private static final UUID HOUSEHOLD_ID = UUID.randomUUID();

  @Mock private NotificationRepository notificationRepository;

  private NotificationEnqueueService service;

  @BeforeEach
  void setUp() {
    service =
        new NotificationEnqueueService(
            notificationRepository,
            new WallClock(
                Clock.fixed(FIXED_NOW, ZoneOffset.UTC), ZoneId.of("Europe/Stockholm")));
  }

  @Test
  void insertsQueuedRecordUnderNaturalKey() {
    when(notificationRepository.insertIfAbsent(any()))
        .thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));

    final EnqueueResult result = service.enqueue(reminder());

    final ArgumentCaptor<NotificationRecord> captor =
        ArgumentCaptor.forClass(NotificationRecord.class);
    verify(notificationRepository).insertIfAbsent(captor.capture());
    final NotificationRecord inserted = captor.getValue();
    assertThat(result.created()).isTrue();
    assertThat(inserted.status()).isEqualTo(NotificationStatus.QUEUED);
    assertThat(inserted.idempotencyKey()).isEqualTo("pickup_reminder|" + APPOINTMENT_ID);
    assertThat(inserted.createdAt()).isEqualTo(FIXED_NOW);
    assertThat(inserted.dueAt()).isEqualTo(DUE_AT);
  }

  @Test
  void returnsExistingRecordWhenKeyIsTaken() {
    final NotificationRecord existing =
        NotificationRecord.queued(
            UUID.randomUUID(),
            NotificationIntent.PICKUP_REMINDER,
            APPOINTMENT_ID,
            HOUSEHOLD_ID,
            "+46701234567",
            "old text",
            "sv",
            "pickup_reminder|" + APPOINTMENT_ID,
            FIXED_NOW.minusSeconds(3600),
            DUE_AT);
    when(notificationRepository.insertIfAbsent(any())).thenReturn(Optional.empty());
    when(notificationRepository.findByIdempotencyKey("pickup_reminder|" + APPOINTMENT_ID))
        .thenReturn(Optional.of(existing));

    final EnqueueResult result = service.enqueue(reminder());

    assertThat(result.created()).isFalse();
    assertThat(result.record()).isSameAs(existing);
  }

  @Test
  void resendUsesNonceSuffixedKey() {
    when(notificationRepository.insertIfAbsent(any()))
        .thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));

    final EnqueueResult result = service.enqueue(reminder().asResend("op-7"));

    assertThat(result.record().idempotencyKey())
        .isEqualTo("pickup_reminder|" + APPOINTMENT_ID + "|resend|op-7");
  }

  @Test
  void missingAppointmentIdIsRejectedBeforeAnyWrite() {
    final EnqueueCommand command =
        EnqueueCommand.of(
            NotificationIntent.PICKUP_REMINDER,
            null,
            HOUSEHOLD_ID,
            "+46701234567",
            "sv",
            "text",
            DUE_AT);

    assertThatThrownBy(() -> service.enqueue(command))
        .isInstanceOf(MissingAppointmentIdException.class);
    verifyNoInteractions(notificationRepository);
  }

  @Test
  void missingDueAtMeansDueNow() {
    when(notificationRepository.insertIfAbsent(any()))
        .thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));

    final EnqueueResult result =
        service.enqueue(
            EnqueueCommand.of(
                NotificationIntent.ENROLMENT,
                null,
                HOUSEHOLD_ID,
                "+46701234567",
                "sv",
                "Välkommen!",
                null));

    assertThat(result.record().dueAt()).isEqualTo(FIXED_NOW);
    assertThat(result.record().appointmentId()).isNull();
  }

  private EnqueueCommand reminder() {
    return EnqueueCommand.of(
        NotificationIntent.PICKUP_REMINDER,
        APPOINTMENT_ID,
        HOUSEHOLD_ID,
        "+46701234567",
        "sv",
        "Matpaket ons 15 okt. 12:00",
        DUE_AT);
  }
}
