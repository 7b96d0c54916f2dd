/**
 * WAV helpers shared by the synthesis engines and playback devices.
 */
package com.phillippitts.readaloud.service.audio;
