package com.bazaarvoice.regroup.unmerge.db.memory;

import com.bazaarvoice.regroup.unmerge.api.ActivityLog;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

public class InMemoryActivityLog implements ActivityLog {

    private final Map<String, Activity> _activities = Maps.newLinkedHashMap();

    @Override
    public synchronized void record(String projectId, String sourceId, String destinationId, @Nullable String actorId,
                                    Map<String, Object> data) {
        Activity activity = new Activity(projectId, sourceId, destinationId, actorId, data);
        _activities.putIfAbsent(projectId + "/" + sourceId + "/" + destinationId, activity);
    }

    public synchronized List<Activity> getActivities() {
        return ImmutableList.copyOf(_activities.values());
    }

    public static class Activity {
        private final String _projectId;
        private final String _sourceId;
        private final String _destinationId;
        private final String _actorId;
        private final Map<String, Object> _data;

        private Activity(String projectId, String sourceId, String destinationId, @Nullable String actorId,
                         Map<String, Object> data) {
            _projectId = requireNonNull(projectId, "projectId");
            _sourceId = requireNonNull(sourceId, "sourceId");
            _destinationId = requireNonNull(destinationId, "destinationId");
            _actorId = actorId;
            _data = ImmutableMap.copyOf(requireNonNull(data, "data"));
        }

        public String getProjectId() {
            return _projectId;
        }

        public String getSourceId() {
            return _sourceId;
        }

        public String getDestinationId() {
            return _destinationId;
        }

        @Nullable
        public String getActorId() {
            return _actorId;
        }

        public Map<String, Object> getData() {
            return _data;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("sourceId", _sourceId)
                    .add("destinationId", _destinationId)
                    .add("data", _data)
                    .toString();
        }
    }
}
