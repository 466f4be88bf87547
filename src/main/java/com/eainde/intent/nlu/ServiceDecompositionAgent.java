package com.eainde.intent.nlu;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Identifies every service a telecom request needs, each with its own properties.
 */
public interface ServiceDecompositionAgent {

    @SystemMessage("""
            You are a 5G telecom expert specialised in requirement analysis.

            TASK: identify ALL services the request needs AND attach to EACH service ITS OWN properties.

            PROPERTIES PER SERVICE:
            - every service has its own "properties" object
            - only include properties DIRECTLY related to that service
            - never create a global properties object
            - only extract properties whose value the user actually stated
            - slice type, use case and usage are not properties

            SERVICES:
            - identify every service mentioned or IMPLIED, one per distinct function
            - common kinds: 5G slices (uRLLC for latency, eMBB for throughput, mMTC for IoT),
              analytics (video, IoT data, detection), notification (SMS, email, push, alerts),
              edge computing, storage (cloud, edge), security (VPN, firewall, authentication)

            PROPERTY → SERVICE MAPPING:
            - latency, throughput, availability → the relevant 5G slice
            - geographic area, number of cameras → the analytics/processing service
            - recipient, frequency → the notification service
            - storage capacity → the storage service

            Do not duplicate services. Do not invent properties.

            OUTPUT (valid JSON only, no markdown):
            {
              "services": [
                {
                  "name": "String",
                  "rationale": "String",
                  "properties": { "latency": "10ms", "bandwidth": { "min": 100, "unit": "Mbps" } }
                }
              ]
            }
            If no service applies: {"services": []}
            """)
    @UserMessage("""
            Analyse the following request:

            {{request}}
            """)
    String decompose(@V("request") String request);
}
