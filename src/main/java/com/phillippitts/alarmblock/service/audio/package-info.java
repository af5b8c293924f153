/**
 * Audio playback: the alarm/ambient coordinator and the pluggable sound output behind it
 * ({@code javasound} for real devices, {@code simulated} for headless hosts).
 */
package com.phillippitts.alarmblock.service.audio;
