package net.kairo.bootstrap.catalog;

import net.kairo.bootstrap.props.KairoProperties;
import net.kairo.core.model.Job;
import net.kairo.core.model.JobDraft;
import net.kairo.core.service.JobAdminService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upserts the {@code kairo.catalog.jobs} entries by name. Invalid entries abort startup.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobAdminService admin;

    public CatalogRegistrar(JobAdminService admin) {
        this.admin = admin;
    }

    public void register(KairoProperties.Catalog catalog) {
        for (var def : catalog.getJobs()) {
            if (def.getName() == null || def.getSchedule() == null) {
                throw new IllegalArgumentException("catalog job name and schedule are required: " + def);
            }
            Job job = admin.upsertByName(new JobDraft(def.getName(), def.getDescription(), def.getSchedule(), def.isActive()));
            log.info("Catalog registered: job='{}' id={} schedule='{}'", job.name(), job.id(), job.schedule());
        }
    }
}
