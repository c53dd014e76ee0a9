package com.bazaarvoice.regroup.job.dao;

import com.bazaarvoice.regroup.common.json.JsonHelper;
import com.bazaarvoice.regroup.job.api.JobStatus;
import com.bazaarvoice.regroup.job.api.JobType;

/**
 * Statuses are stored as JSON text.  The request and result are read back as the classes declared by the job's type.
 */
final class JobStatusCodec {

    private JobStatusCodec() {
        // static helpers
    }

    static String encode(JobStatus<?, ?> status) {
        return JsonHelper.asJson(status);
    }

    static <Q, R> JobStatus<Q, R> decode(String json, JobType<Q, R> jobType) {
        return JsonHelper.fromJson(json,
                JsonHelper.parametricType(JobStatus.class, jobType.getRequestType(), jobType.getResultType()));
    }
}
