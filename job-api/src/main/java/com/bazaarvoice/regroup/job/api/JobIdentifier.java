package com.bazaarvoice.regroup.job.api;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.io.BaseEncoding;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Identifies one job.  The string form is the base32 encoding of a random UUID followed by the job type's name, so the
 * type of any job can be read from its id alone and an id can't be used with the wrong type.
 */
public final class JobIdentifier<Q, R> {

    private static final BaseEncoding ENCODING = BaseEncoding.base32().omitPadding();
    private static final int UUID_BYTES = 16;

    private final String _id;
    private final JobType<Q, R> _jobType;

    private JobIdentifier(String id, JobType<Q, R> jobType) {
        _id = id;
        _jobType = jobType;
    }

    public static <Q, R> JobIdentifier<Q, R> createNew(JobType<Q, R> jobType) {
        requireNonNull(jobType, "jobType");
        UUID uuid = UUID.randomUUID();
        byte[] name = jobType.getName().getBytes(StandardCharsets.UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(UUID_BYTES + name.length)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .put(name);
        return new JobIdentifier<>(ENCODING.encode(buffer.array()), jobType);
    }

    /**
     * Parses an id returned by {@link #toString()}.
     * @throws IllegalArgumentException if the id is malformed or belongs to a different job type
     */
    public static <Q, R> JobIdentifier<Q, R> fromString(String id, JobType<Q, R> jobType) {
        requireNonNull(jobType, "jobType");
        String typeName = getJobTypeNameFromId(id);
        checkArgument(jobType.getName().equals(typeName), "Job %s is of type %s, not %s", id, typeName, jobType);
        return new JobIdentifier<>(id, jobType);
    }

    /**
     * @throws IllegalArgumentException if the id is malformed
     */
    public static String getJobTypeNameFromId(String id) {
        byte[] bytes = ENCODING.decode(requireNonNull(id, "id"));
        checkArgument(bytes.length > UUID_BYTES, "Invalid job id: %s", id);
        return new String(bytes, UUID_BYTES, bytes.length - UUID_BYTES, StandardCharsets.UTF_8);
    }

    public JobType<Q, R> getJobType() {
        return _jobType;
    }

    @JsonValue
    @Override
    public String toString() {
        return _id;
    }

    @Override
    public boolean equals(Object other) {
        return other == this || (other instanceof JobIdentifier && _id.equals(((JobIdentifier<?, ?>) other)._id));
    }

    @Override
    public int hashCode() {
        return _id.hashCode();
    }
}
