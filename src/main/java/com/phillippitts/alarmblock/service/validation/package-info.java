/**
 * Input validation for alarms and volume levels.
 *
 * <p>Validators throw {@link com.phillippitts.alarmblock.exception.ValidationException} before any
 * state is touched; callers never observe a partially applied invalid request.
 */
package com.phillippitts.alarmblock.service.validation;
