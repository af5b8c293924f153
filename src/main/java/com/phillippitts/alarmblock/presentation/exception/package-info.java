/**
 * Maps application exceptions to HTTP responses.
 */
package com.phillippitts.alarmblock.presentation.exception;
