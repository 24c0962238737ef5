package com.erpdashboard.backend.modules.sequence.application;

import com.erpdashboard.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class InvalidBranchCodeException extends ProblemException {

    public static final String CODE = "INVALID_BRANCH_CODE";

    public InvalidBranchCodeException(String branchCode) {
        super(HttpStatus.BAD_REQUEST, CODE, "Branch code is empty or malformed: '" + branchCode + "'");
    }
}
