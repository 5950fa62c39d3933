// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.controller;

import com.dexpool.common.DomainError;
import com.dexpool.common.Result;
import com.dexpool.common.errors.ValidationError;
import com.dexpool.constants.PoolConstants;
import com.dexpool.dto.AddLiquidityRequest;
import com.dexpool.dto.PoolEventResponse;
import com.dexpool.dto.PoolStateResponse;
import com.dexpool.dto.PriceResponse;
import com.dexpool.dto.QuoteResponse;
import com.dexpool.dto.RemoveLiquidityRequest;
import com.dexpool.dto.ShareResponse;
import com.dexpool.dto.SwapRequest;
import com.dexpool.engine.SwapDirection;
import com.dexpool.service.PoolService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * PoolController - liquidity, swaps and read-only pool queries.
 */
@RestController
@RequestMapping("/api/pool")
public class PoolController {

    private static final Logger logger = LoggerFactory.getLogger(PoolController.class);
    private final PoolService poolService;

    public PoolController(PoolService poolService) {
        this.poolService = poolService;
    }

    @GetMapping("/reserves")
    public PoolStateResponse reserves() {
        return PoolStateResponse.of(poolService.assetA(), poolService.assetB(), poolService.state());
    }

    @GetMapping("/price")
    public PriceResponse price() {
        String price = unwrap(poolService.price().map(BigInteger::toString));
        return new PriceResponse(poolService.assetA(), poolService.assetB(), price);
    }

    @GetMapping("/shares/{party}")
    public ShareResponse shares(@PathVariable("party") String party) {
        return new ShareResponse(party,
            poolService.sharesOf(party).toString(),
            poolService.totalShares().toString());
    }

    @GetMapping("/total-shares")
    public ShareResponse totalShares() {
        String total = poolService.totalShares().toString();
        return new ShareResponse(null, total, total);
    }

    /**
     * Quote against explicit reserves when both are given, otherwise against the pool's own
     * reserves in the requested direction. Giving only one of the two is a validation error.
     */
    @GetMapping("/quote")
    public QuoteResponse quote(
            @RequestParam("amountIn") BigInteger amountIn,
            @RequestParam(name = "reserveIn", required = false) BigInteger reserveIn,
            @RequestParam(name = "reserveOut", required = false) BigInteger reserveOut,
            @RequestParam(name = "direction", required = false, defaultValue = "A_TO_B") SwapDirection direction
    ) {
        if ((reserveIn == null) != (reserveOut == null)) {
            throw DomainErrorStatusMapper.toHttpException(
                new ValidationError("reserveIn and reserveOut must be given together"));
        }
        if (reserveIn != null) {
            BigInteger amountOut = unwrap(poolService.quote(amountIn, reserveIn, reserveOut));
            return new QuoteResponse(amountIn.toString(), reserveIn.toString(), reserveOut.toString(),
                null, amountOut.toString(), PoolConstants.FEE_BPS);
        }
        BigInteger amountOut = unwrap(poolService.quote(direction, amountIn));
        return new QuoteResponse(amountIn.toString(), null, null,
            direction.name(), amountOut.toString(), PoolConstants.FEE_BPS);
    }

    @GetMapping("/events")
    public List<PoolEventResponse> events(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return poolService.recentEvents(limit).stream()
            .map(PoolEventResponse::from)
            .toList();
    }

    @PostMapping("/liquidity/add")
    public ResponseEntity<PoolEventResponse> addLiquidity(@Valid @RequestBody AddLiquidityRequest req) {
        logger.info("POST /api/pool/liquidity/add - party: {}, amountA: {}, amountB: {}",
            req.party, req.amountA, req.amountB);
        return ResponseEntity.ok(PoolEventResponse.from(
            unwrap(poolService.addLiquidity(req.party, req.amountA, req.amountB))));
    }

    @PostMapping("/liquidity/remove")
    public ResponseEntity<PoolEventResponse> removeLiquidity(@Valid @RequestBody RemoveLiquidityRequest req) {
        logger.info("POST /api/pool/liquidity/remove - party: {}, shares: {}", req.party, req.shares);
        return ResponseEntity.ok(PoolEventResponse.from(
            unwrap(poolService.removeLiquidity(req.party, req.shares))));
    }

    @PostMapping("/swap")
    public ResponseEntity<PoolEventResponse> swap(@Valid @RequestBody SwapRequest req) {
        logger.info("POST /api/pool/swap - party: {}, direction: {}, amountIn: {}",
            req.party, req.direction, req.amountIn);
        return ResponseEntity.ok(PoolEventResponse.from(
            unwrap(poolService.swap(req.party, req.direction, req.amountIn))));
    }

    private static <T> T unwrap(Result<T, DomainError> result) {
        return result.orElseThrow(DomainErrorStatusMapper::toHttpException);
    }
}
