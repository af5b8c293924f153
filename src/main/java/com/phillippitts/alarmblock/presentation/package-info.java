/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over the
 * coordinators; {@code GlobalExceptionHandler} maps application exceptions to status codes.
 *
 * @since 1.0
 */
package com.phillippitts.alarmblock.presentation;
