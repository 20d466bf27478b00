package com.myorg.evreg.contracts.registration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventCreated {
    private Long id;
    private String title;
    private String location;
    private String date; // ISO date as entered by the organizer
    private Integer seats;
}
