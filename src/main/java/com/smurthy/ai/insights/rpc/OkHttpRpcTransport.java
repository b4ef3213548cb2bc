package com.smurthy.ai.insights.rpc;

import okhttp3.Call;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp-backed transport. The per-request timeout covers the whole call, including reading the body.
 */
public class OkHttpRpcTransport implements RpcTransport {

    private final OkHttpClient httpClient;

    public OkHttpRpcTransport(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RpcHttpResponse execute(RpcHttpRequest request) throws IOException {
        FormBody.Builder form = new FormBody.Builder();
        // f.req must precede at
        request.form().entrySet().stream()
                .sorted(Map.Entry.comparingByKey((a, b) -> Boolean.compare("at".equals(a), "at".equals(b))))
                .forEach(e -> form.add(e.getKey(), e.getValue()));

        Request.Builder builder = new Request.Builder()
                .url(request.url())
                .post(form.build());
        request.headers().forEach(builder::header);

        Call call = httpClient.newCall(builder.build());
        call.timeout().timeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS);

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            return new RpcHttpResponse(response.code(), body != null ? body.bytes() : new byte[0]);
        }
    }
}
