package com.lineguard.proposal;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ProposalProperties.class, SafetyScanProperties.class})
public class ProposalConfig {
}
