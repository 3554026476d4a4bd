package com.rcl.cli;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;
import rcl.runtime.RclBool;
import rcl.runtime.RclDict;
import rcl.runtime.RclInt;
import rcl.runtime.RclList;
import rcl.runtime.RclNull;
import rcl.runtime.RclString;
import rcl.runtime.RclValue;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 用 Gson 读取 JSON 文档并转换为 RCL 值。
 *
 * <p>JSON 数字必须是 64 位范围内的整数；对象转换为以字符串为键的字典。</p>
 */
final class JsonValueReader {

    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = new Gson().getAdapter(JsonElement.class);

    /** Gson 异常消息中的位置，行列均从 1 开始 */
    private static final Pattern LOCATION = Pattern.compile("line (\\d+) column (\\d+)");

    private static final String LENIENT_HINT = "Use JsonReader.setLenient(true) to accept malformed JSON";

    private JsonValueReader() {}

    /**
     * 按严格的 JSON 语法读取文档
     *
     * @param at 文档位置，错误定位在文档内的行列上
     * @throws RclError JSON 语法错误或包含 RCL 无法表示的数字
     */
    static RclValue read(String json, Span at) {
        JsonReader reader = new JsonReader(new StringReader(json));
        reader.setLenient(false);
        JsonElement root;
        try {
            root = ELEMENT_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw locate(json, at, reader.toString()).error("JSON 文档之后出现多余的内容。");
            }
        } catch (IOException e) {
            // MalformedJsonException 与 EOFException 都是 IOException
            String detail = String.valueOf(e.getMessage());
            RclError err = locate(json, at, detail)
                    .error("JSON 解析失败。")
                    .withBody(detail.replace(LENIENT_HINT, "不是合法的 JSON"));
            err.initCause(e);
            throw err;
        }
        return convert(root, at);
    }

    /** 把 Gson 报告的行列换算为文档内的位置，找不到时使用整个文档 */
    private static Span locate(String json, Span doc, String gsonMessage) {
        Matcher m = LOCATION.matcher(gsonMessage);
        if (!m.find()) return doc;
        int line = Integer.parseInt(m.group(1));
        int column = Integer.parseInt(m.group(2));

        int offset = 0;
        for (int l = 1; l < line && offset < json.length(); offset++) {
            if (json.charAt(offset) == '\n') l++;
        }
        offset = Math.min(json.length(), offset + column - 1);
        return new Span(doc.getFile(), line, column, offset, offset < json.length() ? 1 : 0);
    }

    private static RclValue convert(JsonElement element, Span at) {
        if (element == null || element.isJsonNull()) {
            return RclNull.NULL;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive p = element.getAsJsonPrimitive();
            if (p.isBoolean()) return RclBool.of(p.getAsBoolean());
            if (p.isString()) return RclString.of(p.getAsString());
            return convertNumber(p, at);
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            List<RclValue> elements = new ArrayList<RclValue>(array.size());
            for (JsonElement e : array) {
                elements.add(convert(e, at));
            }
            return new RclList(elements);
        }
        JsonObject object = element.getAsJsonObject();
        Map<RclValue, RclValue> entries = new LinkedHashMap<RclValue, RclValue>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            entries.put(RclString.of(entry.getKey()), convert(entry.getValue(), at));
        }
        return new RclDict(entries);
    }

    private static RclValue convertNumber(JsonPrimitive p, Span at) {
        try {
            BigDecimal number = p.getAsBigDecimal();
            return RclInt.of(number.longValueExact());
        } catch (ArithmeticException | NumberFormatException e) {
            // 超出 long 范围、带小数部分，或指数大到 BigDecimal 也无法表示
            throw at.error("不支持的数字 " + p.getAsString() + "。")
                    .withHelp("RCL 只支持 64 位整数。");
        }
    }
}
