package io.surfworks.qhal.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the error taxonomy.
 */
class HalExceptionTest {

    // ===== HalErrorKind tests =====

    @Test
    void thirteenKinds() {
        assertEquals(13, HalErrorKind.values().length);
    }

    @Test
    void onlyUnavailableAndTimeoutAreTransient() {
        for (HalErrorKind kind : HalErrorKind.values()) {
            boolean expected = kind == HalErrorKind.BACKEND_UNAVAILABLE || kind == HalErrorKind.TIMEOUT;
            assertEquals(expected, kind.isTransient(), kind.name());
        }
    }

    @Test
    void recoveryClasses() {
        assertEquals(Recovery.TERMINAL, HalErrorKind.JOB_FAILED.recovery());
        assertEquals(Recovery.TERMINAL, HalErrorKind.JOB_CANCELLED.recovery());
        assertEquals(Recovery.PERMANENT, HalErrorKind.INVALID_SHOTS.recovery());
        assertEquals(Recovery.PERMANENT, HalErrorKind.JOB_NOT_FOUND.recovery());
        assertEquals(Recovery.BACKEND_DEFINED, HalErrorKind.SUBMISSION_FAILED.recovery());
        assertEquals(Recovery.BACKEND_DEFINED, HalErrorKind.BACKEND.recovery());
    }

    // ===== HalException tests =====

    @Test
    void messageIsPrefixedWithKindLabel() {
        HalException e = HalException.invalidCircuit("qubit 7 does not exist");

        assertEquals(HalErrorKind.INVALID_CIRCUIT, e.kind());
        assertEquals("Invalid circuit: qubit 7 does not exist", e.getMessage());
        assertEquals("qubit 7 does not exist", e.detail());
    }

    @Test
    void blankDetailUsesLabelOnly() {
        HalException e = new HalException(HalErrorKind.BACKEND, " ");
        assertEquals("Backend error", e.getMessage());

        HalException noDetail = new HalException(HalErrorKind.CONFIGURATION, null);
        assertEquals("Configuration error", noDetail.getMessage());
        assertNull(noDetail.detail());
    }

    @Test
    void timeoutCarriesJobId() {
        HalException e = HalException.timeout("job-42");

        assertEquals(HalErrorKind.TIMEOUT, e.kind());
        assertEquals("Timeout waiting for job: job-42", e.getMessage());
        assertTrue(e.isTransient());
        assertFalse(e.isTerminal());
    }

    @Test
    void jobFailedIsTerminal() {
        HalException e = HalException.jobFailed("calibration drift");

        assertTrue(e.isTerminal());
        assertFalse(e.isTransient());
        assertEquals(Recovery.TERMINAL, e.recovery());
    }

    @Test
    void submissionFailedKeepsCause() {
        IOException cause = new IOException("connection reset");
        HalException e = HalException.submissionFailed("upload failed", cause);

        assertEquals(HalErrorKind.SUBMISSION_FAILED, e.kind());
        assertSame(cause, e.getCause());
    }

    @Test
    void factoriesMapToTheirKinds() {
        assertEquals(HalErrorKind.BACKEND_UNAVAILABLE, HalException.backendUnavailable("down").kind());
        assertEquals(HalErrorKind.CIRCUIT_TOO_LARGE, HalException.circuitTooLarge("x").kind());
        assertEquals(HalErrorKind.INVALID_SHOTS, HalException.invalidShots("x").kind());
        assertEquals(HalErrorKind.UNSUPPORTED, HalException.unsupported("mid-circuit measurement").kind());
        assertEquals(HalErrorKind.JOB_CANCELLED, HalException.jobCancelled("j").kind());
        assertEquals(HalErrorKind.JOB_NOT_FOUND, HalException.jobNotFound("j").kind());
        assertEquals(HalErrorKind.AUTHENTICATION_FAILED, HalException.authenticationFailed("x").kind());
        assertEquals(HalErrorKind.CONFIGURATION, HalException.configuration("x").kind());
        assertEquals(HalErrorKind.BACKEND, HalException.backend("x").kind());
    }
}
