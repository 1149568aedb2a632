package com.questrail.cbf.api;

/**
 * One averaged output channel placed on an output link.
 *
 * @param channelId          1-based id of the first fine channel averaged into this channel
 * @param bandwidthHz        bandwidth after averaging
 * @param centreFrequencyHz  centre frequency from the band plan
 */
public record OutputChannel(int channelId, double bandwidthHz, double centreFrequencyHz) {}
