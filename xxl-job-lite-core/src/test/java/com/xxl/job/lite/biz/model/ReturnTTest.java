package com.xxl.job.lite.biz.model;

import com.xxl.job.lite.util.GsonTool;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReturnTTest {

    @Test
    void successHasCode200AndNoMessage() {
        assertEquals("{\"code\":200}", GsonTool.toJson(ReturnT.SUCCESS));
        assertTrue(ReturnT.SUCCESS.isSuccess());
    }

    @Test
    void failCarriesMessage() {
        ReturnT<String> fail = ReturnT.fail("job is running");
        assertEquals("{\"code\":500,\"msg\":\"job is running\"}", GsonTool.toJson(fail));
        assertFalse(fail.isSuccess());
    }

    @Test
    void parseLogResultResponse() {
        String json = "{\"code\":200,\"content\":{\"fromLineNum\":1,\"toLineNum\":2,\"logContent\":\"N/A\",\"isEnd\":true}}";
        ReturnT<LogResult> result = GsonTool.fromJson(json, ReturnT.class, LogResult.class);

        assertEquals(ReturnT.SUCCESS_CODE, result.getCode());
        assertNull(result.getMsg());
        assertEquals(LogResult.notAvailable(), result.getContent());
    }

    @Test
    void callbackUsesAdminFieldNames() {
        List<HandleCallbackParam> params = Collections.singletonList(new HandleCallbackParam(7, 1700000000000L, 200, "OK"));
        assertEquals("[{\"logId\":7,\"logDateTim\":1700000000000,\"handleCode\":200,\"handleMsg\":\"OK\"}]",
                GsonTool.toJson(params));
    }
}
