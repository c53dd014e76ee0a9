package com.bazaarvoice.regroup.unmerge;

import com.bazaarvoice.regroup.job.JobConfiguration;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;

/**
 * Top-level configuration, typically loaded from a YAML file.
 */
public class RegroupConfiguration {

    @Valid
    @NotNull
    @JsonProperty("job")
    private JobConfiguration _jobConfiguration = new JobConfiguration();

    @Valid
    @NotNull
    @JsonProperty("unmerge")
    private UnmergeConfiguration _unmergeConfiguration = new UnmergeConfiguration();

    public JobConfiguration getJobConfiguration() {
        return _jobConfiguration;
    }

    public RegroupConfiguration setJobConfiguration(JobConfiguration jobConfiguration) {
        _jobConfiguration = jobConfiguration;
        return this;
    }

    public UnmergeConfiguration getUnmergeConfiguration() {
        return _unmergeConfiguration;
    }

    public RegroupConfiguration setUnmergeConfiguration(UnmergeConfiguration unmergeConfiguration) {
        _unmergeConfiguration = unmergeConfiguration;
        return this;
    }
}
