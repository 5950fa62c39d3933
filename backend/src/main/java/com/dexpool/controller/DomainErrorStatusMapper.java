// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.controller;

import com.dexpool.common.DomainError;
import com.dexpool.common.DomainErrorException;
import com.dexpool.common.errors.CustodyTransferFailedError;
import com.dexpool.common.errors.InsufficientInitialLiquidityError;
import com.dexpool.common.errors.InsufficientLiquidityMintedError;
import com.dexpool.common.errors.InsufficientOutputError;
import com.dexpool.common.errors.InsufficientSharesError;
import com.dexpool.common.errors.InvariantViolationError;
import com.dexpool.common.errors.NoLiquidityError;
import com.dexpool.common.errors.RatioMismatchError;
import com.dexpool.common.errors.ValidationError;
import com.dexpool.common.errors.ZeroAmountError;
import com.dexpool.common.errors.ZeroSwapAmountError;
import org.springframework.http.HttpStatus;

/**
 * Centralizes DomainError -> HttpStatus mapping so all controllers respond consistently.
 */
final class DomainErrorStatusMapper {

    private DomainErrorStatusMapper() {
    }

    static HttpStatus map(final DomainError error) {
        if (error instanceof ValidationError
                || error instanceof ZeroAmountError
                || error instanceof ZeroSwapAmountError) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof RatioMismatchError || error instanceof NoLiquidityError) {
            return HttpStatus.CONFLICT;
        }
        if (error instanceof InsufficientSharesError
                || error instanceof InsufficientOutputError
                || error instanceof InsufficientInitialLiquidityError
                || error instanceof InsufficientLiquidityMintedError) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (error instanceof CustodyTransferFailedError) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (error instanceof InvariantViolationError) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        HttpStatus derived = HttpStatus.resolve(error.httpStatus());
        return derived != null ? derived : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static DomainErrorException toHttpException(final DomainError error) {
        return new DomainErrorException(map(error), error);
    }
}
