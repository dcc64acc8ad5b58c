package com.xxl.job.lite.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;

/**
 * json工具类，执行器收发的消息体都通过它序列化
 */
public class GsonTool {

    private static final Gson gson = new GsonBuilder()
            .setDateFormat("yyyy-MM-dd HH:mm:ss")
            .disableHtmlEscaping()
            .create();

    /**
     * Object 转成 json
     */
    public static String toJson(Object src) {
        return gson.toJson(src);
    }

    /**
     * json 转成特定的 cls 的 Object
     */
    public static <T> T fromJson(String json, Class<T> classOfT) {
        return gson.fromJson(json, classOfT);
    }

    /**
     * json 转成特定的 rawClass<classOfT> 的 Object，比如 ReturnT<LogResult>
     */
    @SuppressWarnings("unchecked")
    public static <T> T fromJson(String json, Class<T> classOfT, Class<?> argClassOfT) {
        Type type = TypeToken.getParameterized(classOfT, argClassOfT).getType();
        return (T) gson.fromJson(json, type);
    }

}
