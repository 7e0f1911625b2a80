package com.webaudit.core.api;

import com.webaudit.core.http.FetchException;
import com.webaudit.core.model.FetchRequest;
import com.webaudit.core.model.FetchResponse;

/** 단일 HTTP 요청. 동시성 제어는 호출자 몫. */
public interface IFetcher {
    FetchResponse fetch(FetchRequest request) throws FetchException, InterruptedException;
}
