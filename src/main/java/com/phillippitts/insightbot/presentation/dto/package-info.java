/**
 * Request and response bodies of the REST command surface.
 */
package com.phillippitts.insightbot.presentation.dto;
