package com.ogt.buildings.service;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.entity.Export;
import com.ogt.buildings.entity.ExportRun;
import com.ogt.buildings.entity.ExportRunStatus;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.repository.ExportRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExportNotificationServiceTest {

    @Mock
    private ExportRunRepository runRepository;
    @Mock
    private JavaMailSender mailSender;

    private BuildingExtractorProperties properties;
    private ExportNotificationService service;
    private Export export;
    private ExportRun run;

    @BeforeEach
    void setUp() {
        properties = new BuildingExtractorProperties();
        properties.getNotification().setSiteUrl("https://buildings.example.org/");
        properties.getNotification().setFrom("noreply@example.org");
        service = new ExportNotificationService(runRepository, mailSender, properties);

        export = Export.builder()
                .id(UUID.randomUUID())
                .name("Centro")
                .areaOfInterest(BuildingFixtures.smallAoi())
                .ownerEmail("owner@example.org")
                .ownerEmailVerified(true)
                .emailNotifications(true)
                .build();
        run = ExportRun.builder()
                .id(UUID.randomUUID())
                .export(export)
                .status(ExportRunStatus.COMPLETED)
                .completedAt(LocalDateTime.of(2024, 6, 1, 10, 2, 30))
                .results(Map.of("building_count", 42L))
                .build();
    }

    @Test
    void sendsEmailWithDownloadLink() {
        when(runRepository.findById(run.getId())).thenReturn(Optional.of(run));

        assertThat(service.sendCompletionEmail(run.getId())).isTrue();

        ArgumentCaptor<SimpleMailMessage> mail = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(mail.capture());
        assertThat(mail.getValue().getTo()).containsExactly("owner@example.org");
        assertThat(mail.getValue().getFrom()).isEqualTo("noreply@example.org");
        assertThat(mail.getValue().getSubject()).isEqualTo("Export Complete: Centro");
        assertThat(mail.getValue().getText())
                .contains("Centro")
                .contains("42")
                .contains("https://buildings.example.org/exports/runs/" + run.getId() + "/download/")
                .doesNotContain("${");
    }

    @Test
    void skipsOwnersWithoutVerifiedOptIn() {
        export.setOwnerEmailVerified(false);
        when(runRepository.findById(run.getId())).thenReturn(Optional.of(run));

        assertThat(service.sendCompletionEmail(run.getId())).isFalse();
        verifyNoInteractions(mailSender);
    }

    @Test
    void skipsRunsThatDidNotComplete() {
        run.setStatus(ExportRunStatus.FAILED);
        when(runRepository.findById(run.getId())).thenReturn(Optional.of(run));

        assertThat(service.sendCompletionEmail(run.getId())).isFalse();
        verifyNoInteractions(mailSender);
    }

    @Test
    void missingRunReturnsFalse() {
        UUID id = UUID.randomUUID();
        when(runRepository.findById(id)).thenReturn(Optional.empty());

        assertThat(service.sendCompletionEmail(id)).isFalse();
    }

    @Test
    void mailFailureReturnsFalse() {
        when(runRepository.findById(run.getId())).thenReturn(Optional.of(run));
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThat(service.sendCompletionEmail(run.getId())).isFalse();
    }
}
