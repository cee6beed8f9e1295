package com.ogt.buildings.service;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.entity.Export;
import com.ogt.buildings.entity.ExportRun;
import com.ogt.buildings.entity.ExportRunStatus;
import com.ogt.buildings.repository.ExportRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;

/**
 * Email de exportación completada. Cualquier fallo se registra y devuelve false;
 * nunca afecta al estado del run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExportNotificationService {

    static final String TEMPLATE = "templates/email/export-complete.txt";

    private static final PropertyPlaceholderHelper PLACEHOLDERS = new PropertyPlaceholderHelper("${", "}");

    private final ExportRunRepository runRepository;
    private final JavaMailSender mailSender;
    private final BuildingExtractorProperties properties;

    public boolean sendCompletionEmail(UUID runId) {
        Optional<ExportRun> found = runRepository.findById(runId);
        if (found.isEmpty()) {
            log.error("❌ ExportRun {} no encontrado para notificación", runId);
            return false;
        }
        ExportRun run = found.get();
        Export export = run.getExport();

        // El opt-in se vuelve a comprobar: pudo cambiar desde que se programó el envío
        if (!export.wantsCompletionEmail()) {
            log.info("Notificación omitida para run {}: sin opt-in o email sin verificar", runId);
            return false;
        }
        if (run.getStatus() != ExportRunStatus.COMPLETED) {
            log.warn("⚠️ Run {} en estado {}, no se notifica", runId, run.getStatus());
            return false;
        }

        try {
            SimpleMailMessage mail = new SimpleMailMessage();
            mail.setFrom(properties.getNotification().getFrom());
            mail.setTo(export.getOwnerEmail());
            mail.setSubject("Export Complete: " + export.getName());
            mail.setText(render(run, export));
            mailSender.send(mail);

            log.info("📧 Email de finalización enviado a {} para run {}", export.getOwnerEmail(), runId);
            return true;
        } catch (IOException | MailException e) {
            log.error("❌ No se pudo enviar el email del run {}: {}", runId, e.getMessage());
            return false;
        }
    }

    String render(ExportRun run, Export export) throws IOException {
        BuildingExtractorProperties.Notification settings = properties.getNotification();
        Properties values = new Properties();
        values.setProperty("siteName", settings.getSiteName());
        values.setProperty("exportName", export.getName());
        values.setProperty("buildingCount", String.valueOf(run.getBuildingCount()));
        values.setProperty("completedAt", String.valueOf(run.getCompletedAt()));
        values.setProperty("downloadUrl", downloadUrl(run.getId()));
        return PLACEHOLDERS.replacePlaceholders(loadTemplate(), values);
    }

    String downloadUrl(UUID runId) {
        String base = properties.getNotification().getSiteUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/exports/runs/" + runId + "/download/";
    }

    private String loadTemplate() throws IOException {
        try (InputStream in = new ClassPathResource(TEMPLATE).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
