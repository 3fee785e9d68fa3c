package com.wangbin.edge.common.web.result;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApiResultTest {

    @Test
    void successCarriesData() {
        ApiResult<String> result = ApiResult.success("ok");

        assertTrue(result.isSuccess());
        assertEquals(200, result.getCode());
        assertEquals("ok", result.getData());
        assertTrue(result.getTimestamp() > 0);
    }

    @Test
    void errorWithExtra() {
        ApiResult<Object> result = ApiResult.error(ResultCode.DATABASE_ERROR.getCode(), "db down")
                .addExtra("path", "/api/monitor/stats");

        assertFalse(result.isSuccess());
        assertEquals(5002, result.getCode());
        assertNull(result.getData());
        assertEquals("/api/monitor/stats", result.getExtra().get("path"));
    }
}
