package com.sdmahjong.controller;

import com.sdmahjong.engine.IllegalActionException;
import com.sdmahjong.engine.InsufficientTilesException;
import com.sdmahjong.model.IllegalHandSizeException;
import com.sdmahjong.model.InvalidTileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * 规则异常统一返回 400 {"error": ...}
 */
@ControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidTileException.class, IllegalHandSizeException.class,
        InsufficientTilesException.class, IllegalActionException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        log.warn("请求无效：{}", e.getMessage());
        Map<String, String> body = new HashMap<>();
        body.put("error", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
