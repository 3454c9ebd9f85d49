package com.vcsight.ingestor.model;

/**
 * The {environment, client, datacenter} triple that says which logical
 * deployment a job's data belongs to.
 *
 * Also used as the value type of the configured pattern table, where any
 * field may be left out (null) and falls back to {@link #UNKNOWN_VALUE}.
 */
public record EnvironmentTag(String environment, String client, String datacenter) {

    public static final String UNKNOWN_VALUE = "unknown";

    public static final EnvironmentTag UNKNOWN =
            new EnvironmentTag(UNKNOWN_VALUE, UNKNOWN_VALUE, UNKNOWN_VALUE);

    /** Tag currently stored on a job, or null when the job was never classified. */
    public static EnvironmentTag of(Job job) {
        if (job.getEnvironment() == null && job.getClientName() == null && job.getDatacenter() == null) {
            return null;
        }
        return new EnvironmentTag(job.getEnvironment(), job.getClientName(), job.getDatacenter());
    }

    /** Copy with every non-null field of {@code override} applied on top of this tag. */
    public EnvironmentTag overriddenBy(EnvironmentTag override) {
        return new EnvironmentTag(
                override.environment() != null ? override.environment() : environment,
                override.client()      != null ? override.client()      : client,
                override.datacenter()  != null ? override.datacenter()  : datacenter);
    }

    public EnvironmentTag withEnvironment(String value) {
        return new EnvironmentTag(value, client, datacenter);
    }

    public EnvironmentTag withClient(String value) {
        return new EnvironmentTag(environment, value, datacenter);
    }
}
