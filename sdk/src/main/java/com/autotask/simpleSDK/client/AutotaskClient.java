package com.autotask.simpleSDK.client;

import com.autotask.simpleSDK.entities.Appointments;
import com.autotask.simpleSDK.entities.BaseEntity;
import com.autotask.simpleSDK.entities.Companies;
import com.autotask.simpleSDK.entities.CompanyCategories;
import com.autotask.simpleSDK.entities.CompanyLocations;
import com.autotask.simpleSDK.entities.Contacts;
import com.autotask.simpleSDK.entities.Contracts;
import com.autotask.simpleSDK.entities.Projects;
import com.autotask.simpleSDK.entities.Quotes;
import com.autotask.simpleSDK.entities.Resources;
import com.autotask.simpleSDK.entities.ServiceCalls;
import com.autotask.simpleSDK.entities.Tasks;
import com.autotask.simpleSDK.entities.TicketNotes;
import com.autotask.simpleSDK.entities.Tickets;
import com.autotask.simpleSDK.entities.TimeEntries;
import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point to the Autotask REST API with one accessor per entity. All entities share the
 * same {@link AutotaskHttpClient} and {@link RequestHandler}.
 */
public class AutotaskClient {
    private final AutotaskHttpClient httpClient;
    private final RequestHandler requestHandler;
    private final Map<String, BaseEntity<?>> entities;
    private final Appointments appointments;
    private final Companies companies;
    private final CompanyCategories companyCategories;
    private final CompanyLocations companyLocations;
    private final Contacts contacts;
    private final Contracts contracts;
    private final Projects projects;
    private final Quotes quotes;
    private final Resources resources;
    private final ServiceCalls serviceCalls;
    private final Tasks tasks;
    private final TicketNotes ticketNotes;
    private final Tickets tickets;
    private final TimeEntries timeEntries;

    public AutotaskClient(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        this.httpClient = httpClient;
        this.requestHandler = requestHandler;
        this.appointments = new Appointments(httpClient, requestHandler);
        this.companies = new Companies(httpClient, requestHandler);
        this.companyCategories = new CompanyCategories(httpClient, requestHandler);
        this.companyLocations = new CompanyLocations(httpClient, requestHandler);
        this.contacts = new Contacts(httpClient, requestHandler);
        this.contracts = new Contracts(httpClient, requestHandler);
        this.projects = new Projects(httpClient, requestHandler);
        this.quotes = new Quotes(httpClient, requestHandler);
        this.resources = new Resources(httpClient, requestHandler);
        this.serviceCalls = new ServiceCalls(httpClient, requestHandler);
        this.tasks = new Tasks(httpClient, requestHandler);
        this.ticketNotes = new TicketNotes(httpClient, requestHandler);
        this.tickets = new Tickets(httpClient, requestHandler);
        this.timeEntries = new TimeEntries(httpClient, requestHandler);

        Map<String, BaseEntity<?>> byName = new LinkedHashMap<>();
        byName.put(Appointments.METADATA.name(), appointments);
        byName.put(Companies.METADATA.name(), companies);
        byName.put(CompanyCategories.METADATA.name(), companyCategories);
        byName.put(CompanyLocations.METADATA.name(), companyLocations);
        byName.put(Contacts.METADATA.name(), contacts);
        byName.put(Contracts.METADATA.name(), contracts);
        byName.put(Projects.METADATA.name(), projects);
        byName.put(Quotes.METADATA.name(), quotes);
        byName.put(Resources.METADATA.name(), resources);
        byName.put(ServiceCalls.METADATA.name(), serviceCalls);
        byName.put(Tasks.METADATA.name(), tasks);
        byName.put(TicketNotes.METADATA.name(), ticketNotes);
        byName.put(Tickets.METADATA.name(), tickets);
        byName.put(TimeEntries.METADATA.name(), timeEntries);
        this.entities = Collections.unmodifiableMap(byName);
    }

    public static AutotaskClientBuilder builder() {
        return new AutotaskClientBuilder();
    }

    public Appointments appointments() {
        return appointments;
    }

    public Companies companies() {
        return companies;
    }

    public CompanyCategories companyCategories() {
        return companyCategories;
    }

    public CompanyLocations companyLocations() {
        return companyLocations;
    }

    public Contacts contacts() {
        return contacts;
    }

    public Contracts contracts() {
        return contracts;
    }

    public Projects projects() {
        return projects;
    }

    public Quotes quotes() {
        return quotes;
    }

    public Resources resources() {
        return resources;
    }

    public ServiceCalls serviceCalls() {
        return serviceCalls;
    }

    public Tasks tasks() {
        return tasks;
    }

    public TicketNotes ticketNotes() {
        return ticketNotes;
    }

    public Tickets tickets() {
        return tickets;
    }

    public TimeEntries timeEntries() {
        return timeEntries;
    }

    /** All entities keyed by name, in catalog order. */
    public Map<String, BaseEntity<?>> entities() {
        return entities;
    }

    /** Looks an entity up by name, ignoring case. */
    public Optional<BaseEntity<?>> entity(String name) {
        for (Map.Entry<String, BaseEntity<?>> entry : entities.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Runs a one-record CompanyCategories query. Resolves {@code false} instead of failing
     * when the API cannot be reached or rejects the credentials.
     */
    public CompletableFuture<Boolean> testConnection() {
        return companyCategories.list(QueryOptions.builder().pageSize(1).build())
            .handle((response, error) -> {
                if (error != null) {
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    requestHandler.getLogger().warn("Connection test failed: {}", cause.getMessage());
                    return false;
                }
                return true;
            });
    }

    public AutotaskHttpClient getHttpClient() {
        return httpClient;
    }

    public RequestHandler getRequestHandler() {
        return requestHandler;
    }
}
