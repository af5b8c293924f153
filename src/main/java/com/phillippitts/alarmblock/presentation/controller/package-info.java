/**
 * REST adapter over the coordinators. Controllers hold no state and translate JSON to domain
 * calls only.
 */
package com.phillippitts.alarmblock.presentation.controller;
