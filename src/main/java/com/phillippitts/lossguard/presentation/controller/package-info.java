/**
 * REST controllers through which remote training jobs report run start and per-step losses.
 *
 * @since 1.0
 */
package com.phillippitts.lossguard.presentation.controller;
