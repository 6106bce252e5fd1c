package net.kairo.app.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import net.kairo.app.web.validation.CronSchedule;
import net.kairo.core.model.JobDraft;

@Schema(description = "Request to create a scheduled job")
public record CreateJobRequest(
        @Schema(description = "Job name, also selects the executor", example = "daily report email")
        @NotBlank @Size(max = 255) String name,
        String description,
        @Schema(description = "Five-field cron expression", example = "0 9 * * *")
        @NotBlank @CronSchedule String schedule,
        @Schema(defaultValue = "true")
        @JsonProperty("isActive") Boolean active
) {
    public JobDraft toDraft() {
        return new JobDraft(name, description, schedule, active);
    }
}
