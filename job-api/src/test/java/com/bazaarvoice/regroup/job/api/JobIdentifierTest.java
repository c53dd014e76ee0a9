package com.bazaarvoice.regroup.job.api;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;

public class JobIdentifierTest {

    private static final JobType<String, String> PAGE_JOB = new JobType<String, String>("page", String.class, String.class) {};
    private static final JobType<String, String> OTHER_JOB = new JobType<String, String>("other", String.class, String.class) {};

    @Test
    public void testTypeNameIsEncodedInId() {
        JobIdentifier<String, String> id = JobIdentifier.createNew(PAGE_JOB);

        assertEquals(JobIdentifier.getJobTypeNameFromId(id.toString()), "page");
        assertEquals(JobIdentifier.fromString(id.toString(), PAGE_JOB), id);
    }

    @Test
    public void testIdsAreUnique() {
        assertNotEquals(JobIdentifier.createNew(PAGE_JOB), JobIdentifier.createNew(PAGE_JOB));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInconsistentTypeIsRejected() {
        JobIdentifier<String, String> id = JobIdentifier.createNew(PAGE_JOB);
        JobIdentifier.fromString(id.toString(), OTHER_JOB);
    }
}
