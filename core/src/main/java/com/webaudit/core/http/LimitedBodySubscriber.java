package com.webaudit.core.http;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * 본문을 최대 maxBytes 까지만 버퍼링하는 BodySubscriber.
 * 한도에 닿으면 구독을 취소하고 그때까지 받은 바이트로 완료한다.
 * 문자 단위 잘라내기와 truncated 판정은 Fetcher 가 한다.
 */
final class LimitedBodySubscriber implements HttpResponse.BodySubscriber<String> {

    private final Charset charset;
    private final long maxBytes;
    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private Flow.Subscription subscription;

    LimitedBodySubscriber(Charset charset, long maxBytes) {
        if (maxBytes < 1) throw new IllegalArgumentException("maxBytes must be >= 1");
        this.charset = (charset != null) ? charset : StandardCharsets.UTF_8;
        this.maxBytes = maxBytes;
    }

    /**
     * maxChars 문자를 넘는지 판정할 수 있을 만큼만 읽는 핸들러.
     * UTF-8 은 문자(char)당 최대 3바이트라 4배 + 여유면 한도 초과 여부가 보존된다.
     */
    static HttpResponse.BodyHandler<String> handler(int maxChars) {
        long maxBytes = Math.min(Integer.MAX_VALUE - 8L, maxChars * 4L + 4);
        return info -> new LimitedBodySubscriber(charsetOf(info.headers()), maxBytes);
    }

    /** Content-Type 의 charset 파라미터, 없거나 모르는 이름이면 UTF-8 */
    static Charset charsetOf(HttpHeaders headers) {
        String ct = headers.firstValue("Content-Type").orElse("");
        for (String part : ct.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    @Override
    public CompletionStage<String> getBody() {
        return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription s) {
        this.subscription = s;
        s.request(1);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
        if (result.isDone()) return;
        for (ByteBuffer b : items) {
            int room = (int) Math.min(b.remaining(), maxBytes - buf.size());
            byte[] chunk = new byte[room];
            b.get(chunk);
            buf.write(chunk, 0, room);
            if (buf.size() >= maxBytes) {
                subscription.cancel();
                finish();
                return;
            }
        }
        subscription.request(1);
    }

    @Override
    public void onError(Throwable t) {
        result.completeExceptionally(t);
    }

    @Override
    public void onComplete() {
        finish();
    }

    private void finish() {
        result.complete(new String(buf.toByteArray(), charset));
    }
}
