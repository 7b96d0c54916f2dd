/**
 * Request and response bodies of the sessions API.
 */
package com.phillippitts.readaloud.presentation.dto;
