package net.kairo.app.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import net.kairo.app.web.validation.CronSchedule;
import net.kairo.core.model.JobPatch;

/** Every field is optional; absent fields keep their stored value. */
@Schema(description = "Partial update of a job")
public record UpdateJobRequest(
        @Size(max = 255) @Pattern(regexp = ".*\\S.*", message = "must not be blank") String name,
        String description,
        @CronSchedule String schedule,
        @JsonProperty("isActive") Boolean active
) {
    public JobPatch toPatch() {
        return new JobPatch(name, description, schedule, active, null);
    }
}
