package com.webaudit.core.api;

import com.webaudit.core.model.PageRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 크롤된 페이지의 파라미터를 대상으로 하는 테스터.
 * finding 은 나오는 즉시 sink 로 흘려보낸다(타임아웃 시 부분 결과 보존).
 */
public interface IParamTester<F> {

    void test(List<PageRecord> pages, Consumer<? super F> sink) throws InterruptedException;

    default List<F> test(List<PageRecord> pages) throws InterruptedException {
        List<F> out = Collections.synchronizedList(new ArrayList<>());
        test(pages, out::add);
        synchronized (out) {
            return new ArrayList<>(out);
        }
    }
}
