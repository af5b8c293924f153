/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.alarmblock.config.AlarmConfig} - alarm store, trigger scheduler
 *       and coordinator</li>
 *   <li>{@link com.phillippitts.alarmblock.config.ThreadPoolConfig} - trigger scheduler pool and
 *       notification dispatcher</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.audio} - audio backend selection</li>
 *   <li>{@code config.logging} - request-scoped logging context</li>
 *   <li>{@code config.properties} - typed {@code application.properties} bindings</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.alarmblock.config;
