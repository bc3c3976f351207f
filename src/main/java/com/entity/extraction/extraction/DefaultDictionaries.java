package com.entity.extraction.extraction;

import com.entity.extraction.core.model.EntityType;

import java.util.List;

/**
 * Built-in term lists for the dictionary extractor.
 */
public final class DefaultDictionaries {

    public static final double ORGANIZATION_CONFIDENCE = 0.9;
    public static final double TECHNICAL_TERM_CONFIDENCE = 0.8;
    public static final double JOB_TITLE_CONFIDENCE = 0.8;
    public static final double SKILL_CONFIDENCE = 0.7;
    public static final double DATABASE_NAME_CONFIDENCE = 0.6;

    private DefaultDictionaries() {
        // Utility class
    }

    static void register(DictionaryEntityExtractor extractor) {
        extractor.addTerms(EntityType.ORGANIZATION, organizations(), ORGANIZATION_CONFIDENCE);
        extractor.addTerms(EntityType.TECHNICAL_TERM, technicalTerms(), TECHNICAL_TERM_CONFIDENCE);
        extractor.addTerms(EntityType.JOB_TITLE, jobTitles(), JOB_TITLE_CONFIDENCE);
        extractor.addTerms(EntityType.SKILL, skills(), SKILL_CONFIDENCE);
        extractor.addTerms(EntityType.DATABASE_TABLE, databaseTables(), DATABASE_NAME_CONFIDENCE);
        extractor.addTerms(EntityType.DATABASE_COLUMN, databaseColumns(), DATABASE_NAME_CONFIDENCE);
    }

    public static List<String> organizations() {
        return List.of(
                "Microsoft", "Google", "Apple", "Amazon", "Facebook", "Tesla", "IBM",
                "Intel", "Oracle", "Salesforce", "Adobe", "Netflix", "Spotify",
                "LinkedIn", "Twitter", "Uber", "Airbnb", "eBay", "PayPal", "Slack",
                "Zoom", "GitLab", "GitHub", "Atlassian", "JIRA", "Confluence", "Trello");
    }

    public static List<String> technicalTerms() {
        return List.of(
                "API", "REST", "GraphQL", "SQL", "HTTP", "HTTPS", "TCP", "UDP", "IP",
                "OAuth", "JWT", "JSON", "XML", "YAML", "HTML", "CSS", "JavaScript",
                "TypeScript", "Python", "Java", "C#", "C++", "Go", "Rust", "Kotlin",
                "Swift", "Docker", "Kubernetes", "Microservice", "Serverless",
                "Machine Learning", "Artificial Intelligence", "Data Science",
                "Big Data", "Cloud Computing", "DevOps", "CI/CD", "Git", "CRUD",
                "Database", "NoSQL", "PostgreSQL", "MySQL", "MongoDB", "Redis");
    }

    public static List<String> jobTitles() {
        return List.of(
                "CEO", "CTO", "CFO", "COO", "CIO", "CMO", "CISO",
                "Director", "Manager", "VP", "Vice President", "SVP", "EVP",
                "Software Engineer", "Data Scientist", "Product Manager",
                "Project Manager", "UX Designer", "UI Designer", "DevOps Engineer",
                "Systems Administrator", "Database Administrator", "Network Engineer",
                "Security Engineer", "QA Engineer", "Tester", "Technical Writer",
                "Scrum Master", "Agile Coach", "Tech Lead", "Team Lead",
                "Principal Engineer", "Senior Engineer", "Junior Engineer");
    }

    public static List<String> skills() {
        return List.of(
                "Programming", "Coding", "Development", "Testing", "Debugging",
                "Web Development", "Mobile Development", "Backend", "Frontend",
                "Full Stack", "Database Design", "System Architecture",
                "Cloud Architecture", "Security Analysis", "Network Administration",
                "Project Management", "Technical Writing", "Data Analysis",
                "Business Intelligence", "Machine Learning", "Natural Language Processing",
                "Computer Vision", "DevOps", "CI/CD", "Version Control", "Git",
                "Agile", "Scrum", "Kanban", "Leadership", "Team Management");
    }

    public static List<String> databaseTables() {
        return List.of(
                "Users", "Customers", "Products", "Orders", "Payments",
                "Transactions", "Accounts", "Profiles", "Sessions", "Logs",
                "Configurations", "Settings", "Permissions", "Roles", "Groups",
                "Departments", "Categories", "Tags", "Comments", "Reviews",
                "Ratings", "Metrics", "Analytics", "Reports", "Audits",
                "Inventory", "Subscriptions", "Plans", "Features", "Pricing");
    }

    public static List<String> databaseColumns() {
        return List.of(
                "id", "name", "email", "phone", "address", "city", "state",
                "country", "zip", "postal_code", "created_at", "updated_at",
                "deleted_at", "status", "type", "category", "description",
                "price", "cost", "quantity", "user_id", "customer_id",
                "order_id", "product_id", "payment_id", "transaction_id",
                "active", "enabled", "verified", "password", "token");
    }
}
