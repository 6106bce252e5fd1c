package net.kairo.app.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import net.kairo.app.web.dto.CreateJobRequest;
import net.kairo.app.web.dto.JobResponse;
import net.kairo.app.web.dto.UpdateJobRequest;
import net.kairo.core.model.Job;
import net.kairo.core.service.JobAdminService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/jobs")
@Tag(name = "Jobs", description = "Create and manage scheduled jobs")
public class JobController {

    private final JobAdminService jobs;

    public JobController(JobAdminService jobs) {
        this.jobs = jobs;
    }

    @PostMapping
    @Operation(summary = "Create a job", description = "The job becomes due at the next tick unless inactive")
    public ResponseEntity<JobResponse> create(@Valid @RequestBody CreateJobRequest req) {
        Job created = jobs.create(req.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(created));
    }

    @GetMapping
    @Operation(summary = "List all jobs")
    public List<JobResponse> list() {
        return jobs.list().stream().map(JobResponse::from).toList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a job by id")
    public JobResponse get(@PathVariable("id") long id) {
        return JobResponse.from(jobs.get(id));
    }

    /**
     * Partial update. Changing the schedule of a job that already ran recomputes its next run.
     */
    @PatchMapping("/{id}")
    @Operation(summary = "Update a job")
    public JobResponse update(@PathVariable("id") long id, @Valid @RequestBody UpdateJobRequest req) {
        return JobResponse.from(jobs.update(id, req.toPatch()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a job")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        jobs.delete(id);
        return ResponseEntity.noContent().build();
    }
}
