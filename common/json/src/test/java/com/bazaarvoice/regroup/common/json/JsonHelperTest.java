package com.bazaarvoice.regroup.common.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.Map;

import static org.testng.Assert.assertEquals;

public class JsonHelperTest {

    @Test
    public void testInstantsAreWrittenAsIsoStrings() {
        assertEquals(JsonHelper.asJson(ImmutableMap.of("at", Instant.ofEpochMilli(1386372357023L))),
                "{\"at\":\"2013-12-06T23:25:57.023Z\"}");
    }

    @Test
    public void testFromJson() {
        Map<String, Object> map = JsonHelper.fromJson("{\"a\":1,\"b\":[\"x\"]}", new TypeReference<Map<String, Object>>() {});
        assertEquals(map.get("a"), 1);
        assertEquals(map.get("b"), ImmutableList.of("x"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMalformedJson() {
        JsonHelper.fromJson("{\"a\":", Map.class);
    }

    @Test
    public void testConvert() {
        Map<?, ?> converted = JsonHelper.convert(new Sample("hello", 3), Map.class);
        assertEquals(converted, ImmutableMap.of("name", "hello", "count", 3));
    }

    public static class Sample {
        private final String _name;
        private final int _count;

        public Sample(String name, int count) {
            _name = name;
            _count = count;
        }

        public String getName() {
            return _name;
        }

        public int getCount() {
            return _count;
        }
    }
}
